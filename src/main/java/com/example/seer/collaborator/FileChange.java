package com.example.seer.collaborator;

public record FileChange(String path, String content) {
}
