package io.botpoll.core;

public record Location(double longitude, double latitude) {}
