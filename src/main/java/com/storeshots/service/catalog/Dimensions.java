package com.storeshots.service.catalog;

public record Dimensions(int width, int height) {

    public static Dimensions parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Dimensions must not be null");
        }
        String[] parts = value.trim().toLowerCase().split("x");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected WIDTHxHEIGHT but got '" + value + "'");
        }
        try {
            return new Dimensions(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Expected WIDTHxHEIGHT but got '" + value + "'", ex);
        }
    }

    public boolean isPositive() {
        return width > 0 && height > 0;
    }

    public boolean matches(int otherWidth, int otherHeight) {
        return width == otherWidth && height == otherHeight;
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
