package com.jroute.compiler;

public record Token(String text, String raw, int index) {
}
