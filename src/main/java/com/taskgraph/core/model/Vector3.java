package com.taskgraph.core.model;

/**
 * Immutable single-precision 3D vector.
 */
public record Vector3(float x, float y, float z) {

    public static final Vector3 ZERO = new Vector3(0f, 0f, 0f);

    public Vector3 plus(Vector3 other) {
        return new Vector3(x + other.x, y + other.y, z + other.z);
    }

    public Vector3 minus(Vector3 other) {
        return new Vector3(x - other.x, y - other.y, z - other.z);
    }

    public Vector3 scale(float factor) {
        return new Vector3(x * factor, y * factor, z * factor);
    }

    public float length() {
        return (float) Math.sqrt((double) x * x + (double) y * y + (double) z * z);
    }

    public float distanceTo(Vector3 other) {
        return minus(other).length();
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + "," + z + ")";
    }
}
