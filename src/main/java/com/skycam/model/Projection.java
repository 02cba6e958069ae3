package com.skycam.model;

import java.util.Locale;

// Funcion de proyeccion del objetivo: angulo cenital (rad) a distancia en pixeles desde el
// centro de la camara.
public enum Projection {

    LINEAR {
        @Override
        public double theta2r(double theta, double radius) {
            return radius / (Math.PI / 2) * theta;
        }

        @Override
        public double r2theta(double r, double radius) {
            return r / radius * (Math.PI / 2);
        }

        @Override
        public boolean isValid(double r, double radius) {
            return true;
        }
    },

    // Fisheye de angulo equisolido (Sigma 4.5mm f3.5).
    EQUISOLID {
        @Override
        public double theta2r(double theta, double radius) {
            return 2 / SQRT2 * radius * Math.sin(theta / 2);
        }

        @Override
        public double r2theta(double r, double radius) {
            return Math.asin(r / (2 / SQRT2) / radius) * 2;
        }

        @Override
        public boolean isValid(double r, double radius) {
            return r / (2 / SQRT2) / radius <= 1;
        }
    };

    private static final double SQRT2 = Math.sqrt(2);

    public abstract double theta2r(double theta, double radius);

    // Inversa de theta2r; NaN fuera del circulo valido.
    public abstract double r2theta(double r, double radius);

    public abstract boolean isValid(double r, double radius);

    public static Projection fromName(String name) {
        if (name == null) throw new IllegalArgumentException("Projection name is missing");
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "lin":
            case "linear":
                return LINEAR;
            case "equisolid":
            case "equisolid-angle":
                return EQUISOLID;
            default:
                throw new IllegalArgumentException("Unknown angle projection: " + name);
        }
    }
}
