package com.skycam.model;

import java.util.Locale;

// Transmision atmosferica en funcion de la altitud. a es la transmision en el cenit y c el
// coeficiente de extincion.
public enum AirMassModel {

    // Atmosfera plana: masa de aire = sec x.
    PLANAR {
        @Override
        public double transmission(double altitude, double a, double c, double elevationKm) {
            double x = Math.PI / 2 - altitude;
            return a * Math.exp(-c * (1 / Math.cos(x) - 1));
        }
    },

    // Aproximacion de Young (1967).
    YOUNG {
        @Override
        public double transmission(double altitude, double a, double c, double elevationKm) {
            double sec = 1 / Math.cos(Math.PI / 2 - altitude);
            return a * Math.exp(-c * (sec * (1 - 0.0012 * (sec * sec - 1)) - 1));
        }
    },

    // Atmosfera esferica homogenea vista desde la altura del observador.
    SPHERICAL {
        @Override
        public double transmission(double altitude, double a, double c, double elevationKm) {
            double x = Math.PI / 2 - altitude;
            return a * Math.exp(-c * (sphericalAirMass(x, elevationKm) - sphericalAirMass(0, elevationKm)));
        }
    };

    public static final double EARTH_RADIUS_KM = 6371;
    public static final double ATMOSPHERE_HEIGHT_KM = 9.5;

    public abstract double transmission(double altitude, double a, double c, double elevationKm);

    static double sphericalAirMass(double zenithAngle, double elevationKm) {
        double r = EARTH_RADIUS_KM / ATMOSPHERE_HEIGHT_KM;
        double y = elevationKm / ATMOSPHERE_HEIGHT_KM;
        double cos = Math.cos(zenithAngle);
        return Math.sqrt((r + y) * (r + y) * cos * cos + 2 * r * (1 - y) - y * y + 1) - (r + y) * cos;
    }

    public static AirMassModel fromName(String name) {
        if (name != null) {
            try {
                return valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown airmass model: '" + name + "'", e);
            }
        }
        throw new IllegalArgumentException("Unknown airmass model: null");
    }
}
