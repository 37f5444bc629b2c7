package com.eainde.expedition.inference;

public record RenderedPrompt(String name, String system, String user) {
}
