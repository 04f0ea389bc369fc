package dev.univer.gainspend.service;

/** Кто постучался к боту без доступа. username и firstName могут быть null. */
public record AccessRequest(Long userId, String username, String firstName) {

    public String describe() {
        StringBuilder sb = new StringBuilder();
        if (firstName != null && !firstName.isBlank()) sb.append(firstName.trim()).append(' ');
        if (username != null && !username.isBlank()) sb.append('@').append(username.trim()).append(' ');
        sb.append("(ID ").append(userId).append(')');
        return sb.toString();
    }
}
