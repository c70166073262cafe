package com.triagedesk.support.desk.model;

public record Agent(String id, String name, String email, Team team, AgentRole role, boolean active) {
}
