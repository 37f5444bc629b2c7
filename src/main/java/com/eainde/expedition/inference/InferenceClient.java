package com.eainde.expedition.inference;

/**
 * Structured inference backend. Implementations must distinguish a timeout
 * ({@link com.eainde.expedition.error.InferenceTimeoutException}) from a response that does not fit the schema
 * ({@link com.eainde.expedition.error.MalformedResponseException}). Rate limits, server errors and I/O failures
 * are a {@link com.eainde.expedition.error.TransientBackendException}; any other backend failure is a
 * {@link com.eainde.expedition.error.BackendRejectedException} and is not retried.
 */
public interface InferenceClient {

    <T> T invoke(InferenceRequest request, Class<T> responseType);
}
