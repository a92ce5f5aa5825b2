package com.seedforge.core.error;

public class InvalidConfigurationException extends SeedForgeException {
    public InvalidConfigurationException(String message) { super(message); }
}
