package com.skycam.model;

// Fila de la tabla de objetos. Los campos de posicion se rellenan por imagen y los de
// deteccion por cada tamano de kernel; cada etapa trabaja sobre una copy().
public class CelestialObject {

    public enum Kind { STAR, PLANET, POINT_OF_INTEREST, SUN, MOON, WHOLE_SKY }

    public final Kind kind;
    public final int id;
    public final String name;

    // Catalogo (rad)
    public double ra = Double.NaN;
    public double dec = Double.NaN;
    public double magnitude = Double.NaN;
    public double radius = Double.NaN;       // grados, solo puntos de interes

    // Posicion de la imagen actual
    public double azimuth = Double.NaN;
    public double altitude = Double.NaN;
    public double x = Double.NaN;
    public double y = Double.NaN;
    public double angleToMoon = Double.NaN;

    // Deteccion
    public double kernelSize = Double.NaN;
    public int maxX = -1;
    public int maxY = -1;
    public double responseRaw = Double.NaN;
    public double response = Double.NaN;
    public double responseGrad = Double.NaN;
    public double responseSobel = Double.NaN;
    public double visible = 0.0;
    public int blobSize = -1;
    public double starPercentage = Double.NaN;

    public CelestialObject(Kind kind, int id, String name) {
        this.kind = kind;
        this.id = id;
        this.name = name;
    }

    public static CelestialObject star(int id, String name, double ra, double dec, double magnitude) {
        CelestialObject s = new CelestialObject(Kind.STAR, id, name);
        s.ra = ra;
        s.dec = dec;
        s.magnitude = magnitude;
        return s;
    }

    public static CelestialObject pointOfInterest(int id, String name, double ra, double dec, double radius) {
        CelestialObject p = new CelestialObject(Kind.POINT_OF_INTEREST, id, name);
        p.ra = ra;
        p.dec = dec;
        p.radius = radius;
        return p;
    }

    // Ancla sintetica en el cenit que cubre todo el cielo visible.
    public static CelestialObject wholeSky(double openingAngle) {
        CelestialObject p = new CelestialObject(Kind.WHOLE_SKY, -1, "Total_sky");
        p.azimuth = 0;
        p.altitude = Math.PI / 2;
        p.radius = openingAngle;
        return p;
    }

    public boolean hasEquatorial() {
        return Double.isFinite(ra) && Double.isFinite(dec);
    }

    // Flujo relativo 100^(-m/5); las estrellas brillantes pesan mas.
    public double fluxWeight() {
        return Math.pow(100, -magnitude / 5);
    }

    public CelestialObject copy() {
        CelestialObject c = new CelestialObject(kind, id, name);
        c.ra = ra;
        c.dec = dec;
        c.magnitude = magnitude;
        c.radius = radius;
        c.azimuth = azimuth;
        c.altitude = altitude;
        c.x = x;
        c.y = y;
        c.angleToMoon = angleToMoon;
        c.kernelSize = kernelSize;
        c.maxX = maxX;
        c.maxY = maxY;
        c.responseRaw = responseRaw;
        c.response = response;
        c.responseGrad = responseGrad;
        c.responseSobel = responseSobel;
        c.visible = visible;
        c.blobSize = blobSize;
        c.starPercentage = starPercentage;
        return c;
    }

    @Override
    public String toString() {
        return String.format("%s[%d %s mag=%.2f x=%.1f y=%.1f vis=%.2f]", kind, id, name, magnitude, x, y, visible);
    }
}
