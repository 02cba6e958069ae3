package com.skycam.service;

import com.skycam.model.AirMassModel;
import com.skycam.model.CelestialObject;
import java.util.List;

// Corrige la extincion y puntua la visibilidad de cada estrella entre dos rectas en el plano
// (magnitud, log10 respuesta): por encima de la superior = 1, por debajo de la inferior = 0,
// interpolacion lineal entre ambas.
public class VisibilityClassifier {

    private final double upperSlope;
    private final double upperIntercept;
    private final double lowerSlope;
    private final double lowerIntercept;
    private final AirMassModel airMass;
    private final double absorption;
    private final double elevationKm;

    public VisibilityClassifier(double[] upper, double[] lower, AirMassModel airMass,
                                double absorption, double elevationKm) {
        this.upperSlope = upper[0];
        this.upperIntercept = upper[1];
        this.lowerSlope = lower[0];
        this.lowerIntercept = lower[1];
        this.airMass = airMass;
        this.absorption = absorption;
        this.elevationKm = elevationKm;
    }

    public double correct(double rawResponse, double altitude) {
        return rawResponse / airMass.transmission(altitude, 1, absorption, elevationKm);
    }

    public double visibility(double magnitude, double response) {
        double upper = magnitude * upperSlope + upperIntercept;
        double lower = magnitude * lowerSlope + lowerIntercept;
        if (!(upper > lower)) return 0;
        double v = (Math.log10(response) - lower) / (upper - lower);
        if (Double.isNaN(v)) return 0;
        return Math.max(0, Math.min(1, v));
    }

    // In situ sobre la tabla de la imagen: responseRaw, response corregida y visible.
    public void classify(List<CelestialObject> stars) {
        for (CelestialObject s : stars) {
            s.responseRaw = s.response;
            s.response = correct(s.responseRaw, s.altitude);
            s.visible = visibility(s.magnitude, s.response);
        }
    }
}
