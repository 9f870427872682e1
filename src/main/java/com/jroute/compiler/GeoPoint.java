package com.jroute.compiler;

public record GeoPoint(double latitude, double longitude) {
}
