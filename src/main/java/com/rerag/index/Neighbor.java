package com.rerag.index;

public record Neighbor(String id, double distance) {
}
