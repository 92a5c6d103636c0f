package com.sonicgalaxy.app.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A point in emotional space.
 * <p>
 * The four intrinsic dimensions come straight from the track's DNA profile.
 * {@code x}, {@code y} and {@code z} are produced by an embedding run and are only
 * meaningful relative to the other tracks of the same run; they stay at zero for
 * coordinates that were never embedded (interpolation targets, waypoints).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class EmotionalCoordinate {

    double valence;     // -1.0 (sad) to 1.0 (happy)
    double energy;      // 0.0 (calm) to 1.0 (energetic)
    double complexity;  // 0.0 (simple) to 1.0 (complex)
    double tension;     // 0.0 (relaxed) to 1.0 (tense)

    double x;
    double y;
    double z;

    public static EmotionalCoordinate of(double valence, double energy, double complexity, double tension) {
        return EmotionalCoordinate.builder()
                .valence(valence)
                .energy(energy)
                .complexity(complexity)
                .tension(tension)
                .build();
    }

    public static EmotionalCoordinate fromArray(double[] values) {
        return of(values[0], values[1], values[2], values[3]);
    }

    public EmotionalCoordinate withPosition(double x, double y, double z) {
        return toBuilder().x(x).y(y).z(z).build();
    }

    public double[] toArray() {
        return new double[]{valence, energy, complexity, tension};
    }

    public double[] toPositionArray() {
        return new double[]{x, y, z};
    }

    /**
     * Euclidean distance over the four emotional dimensions.
     */
    public double distanceTo(EmotionalCoordinate other) {
        double dv = valence - other.valence;
        double de = energy - other.energy;
        double dc = complexity - other.complexity;
        double dt = tension - other.tension;
        return Math.sqrt(dv * dv + de * de + dc * dc + dt * dt);
    }

    /**
     * Euclidean distance in the embedded 3D space.
     */
    public double positionDistanceTo(EmotionalCoordinate other) {
        double dx = x - other.x;
        double dy = y - other.y;
        double dz = z - other.z;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    /**
     * Linear blend of the emotional dimensions, {@code t = 0} giving this coordinate
     * and {@code t = 1} giving {@code target}. Position is not carried over.
     */
    public EmotionalCoordinate interpolate(EmotionalCoordinate target, double t) {
        return of(
                valence + t * (target.valence - valence),
                energy + t * (target.energy - energy),
                complexity + t * (target.complexity - complexity),
                tension + t * (target.tension - tension));
    }
}
