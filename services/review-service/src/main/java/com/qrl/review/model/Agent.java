package com.qrl.review.model;

public record Agent(String id, String name, String team, String position, boolean removed) {
}
