package com.skycam.service;

import com.skycam.model.CelestialObject;
import com.skycam.model.CelestialObject.Kind;
import com.skycam.model.CelestialPoint;
import com.skycam.model.HorizontalPoint;
import com.skycam.model.Observer;
import java.util.ArrayList;
import java.util.List;

// Efemerides de baja precision (nivel de minutos de arco) para Sol, Luna y planetas. Series
// del Astronomical Almanac y elementos keplerianos medios J2000 (validos 1800-2050).
public class EphemerisService {

    private static final double J2000 = 2451545.0;
    private static final double OBLIQUITY_J2000 = Math.toRadians(23.43928);
    private static final double EARTH_RADIUS_KM = 6378.14;
    private static final double AU_KM = 1.495978707e8;

    private static final String[] PLANET_NAMES = {
        "Mercury", "Venus", "Mars", "Jupiter", "Saturn", "Uranus", "Neptune"
    };

    // a, da, e, de, I, dI, L, dL, long.peri, dlong.peri, nodo, dnodo (por siglo juliano)
    private static final double[][] ELEMENTS = {
        {0.38709927, 0.00000037, 0.20563593, 0.00001906, 7.00497902, -0.00594749,
            252.25032350, 149472.67411175, 77.45779628, 0.16047689, 48.33076593, -0.12534081},
        {0.72333566, 0.00000390, 0.00677672, -0.00004107, 3.39467605, -0.00078890,
            181.97909950, 58517.81538729, 131.60246718, 0.00268329, 76.67984255, -0.27769418},
        {1.52371034, 0.00001847, 0.09339410, 0.00007882, 1.84969142, -0.00813131,
            -4.55343205, 19140.30268499, -23.94362959, 0.44441088, 49.55953891, -0.29257343},
        {5.20288700, -0.00011607, 0.04838624, -0.00013253, 1.30439695, -0.00183714,
            34.39644051, 3034.74612775, 14.72847983, 0.21252668, 100.47390909, 0.20469106},
        {9.53667594, -0.00125060, 0.05386179, -0.00050991, 2.48599187, 0.00193609,
            49.95424423, 1222.49362201, 92.59887831, -0.41897216, 113.66242448, -0.28867794},
        {19.18916464, -0.00196176, 0.04725744, -0.00004397, 0.77263783, -0.00242939,
            313.23810451, 428.48202785, 170.95427630, 0.40805281, 74.01692503, 0.04240589},
        {30.06992276, 0.00026291, 0.00859048, 0.00005105, 1.77004347, 0.00035372,
            -55.12002969, 218.45945325, 44.96476227, -0.32241464, 131.78422574, -0.00508664},
    };

    private static final double[] EARTH_MOON_BARYCENTER = {
        1.00000261, 0.00000562, 0.01671123, -0.00004392, -0.00001531, -0.01294668,
        100.46457166, 35999.37244981, 102.93768193, 0.32327364, 0.0, 0.0
    };

    // Magnitud: H + 5 log10(r*delta) + c1*i + c2*i^2 + c3*i^3 (i = angulo de fase en grados)
    private static final double[][] MAGNITUDE = {
        {-0.42, 0.0380, -0.000273, 0.000002},
        {-4.40, 0.0009, 0.000239, -0.00000065},
        {-1.52, 0.016, 0, 0},
        {-9.40, 0.005, 0, 0},
        {-8.88, 0, 0, 0},
        {-7.19, 0, 0, 0},
        {-6.87, 0, 0, 0},
    };

    public CelestialObject sun(Observer observer) {
        CelestialObject sun = new CelestialObject(Kind.SUN, -10, "Sun");
        CelestialPoint eq = sunEquatorial(observer.julianDate());
        sun.ra = eq.ra;
        sun.dec = eq.dec;
        HorizontalPoint hp = Coordinates.equatorialToHorizontal(eq.ra, eq.dec, observer);
        sun.azimuth = hp.azimuth;
        sun.altitude = hp.altitude;
        return sun;
    }

    // Posicion topocentrica de la Luna (se corrige la paralaje en altitud).
    public CelestialObject moon(Observer observer) {
        double[] ecl = moonEcliptic(observer.julianDate());
        CelestialPoint eq = eclipticToEquatorial(ecl[0], ecl[1], OBLIQUITY_J2000);
        CelestialObject moon = new CelestialObject(Kind.MOON, -11, "Moon");
        moon.ra = eq.ra;
        moon.dec = eq.dec;
        HorizontalPoint hp = Coordinates.equatorialToHorizontal(eq.ra, eq.dec, observer);
        moon.azimuth = hp.azimuth;
        moon.altitude = hp.altitude - Math.asin(Math.sin(ecl[2]) * Math.cos(hp.altitude));
        return moon;
    }

    // Fraccion iluminada del disco lunar [0,1].
    public double moonPhase(Observer observer) {
        double jd = observer.julianDate();
        double[] ecl = moonEcliptic(jd);
        double sunLon = sunEclipticLongitude(jd);
        double cosPsi = Math.cos(ecl[1]) * Math.cos(ecl[0] - sunLon);
        double psi = Math.acos(Math.max(-1, Math.min(1, cosPsi)));
        double moonDistance = EARTH_RADIUS_KM / Math.sin(ecl[2]);
        double sunDistance = sunDistanceAu(jd) * AU_KM;
        double phaseAngle = Math.atan2(sunDistance * Math.sin(psi), moonDistance - sunDistance * Math.cos(psi));
        return (1 + Math.cos(phaseAngle)) / 2;
    }

    public List<CelestialObject> planets(Observer observer) {
        double t = observer.centuriesSinceJ2000();
        double[] earth = heliocentric(EARTH_MOON_BARYCENTER, t);
        double earthSun = norm(earth);

        List<CelestialObject> planets = new ArrayList<>();
        for (int i = 0; i < PLANET_NAMES.length; i++) {
            double[] p = heliocentric(ELEMENTS[i], t);
            double[] g = {p[0] - earth[0], p[1] - earth[1], p[2] - earth[2]};
            double r = norm(p);
            double delta = norm(g);

            double xe = g[0];
            double ye = g[1] * Math.cos(OBLIQUITY_J2000) - g[2] * Math.sin(OBLIQUITY_J2000);
            double ze = g[1] * Math.sin(OBLIQUITY_J2000) + g[2] * Math.cos(OBLIQUITY_J2000);

            CelestialObject planet = new CelestialObject(Kind.PLANET, -100 - i, PLANET_NAMES[i]);
            planet.ra = Coordinates.mod2pi(Math.atan2(ye, xe));
            planet.dec = Math.atan2(ze, Math.hypot(xe, ye));

            double cosI = (r * r + delta * delta - earthSun * earthSun) / (2 * r * delta);
            double phase = Math.toDegrees(Math.acos(Math.max(-1, Math.min(1, cosI))));
            double[] m = MAGNITUDE[i];
            planet.magnitude = m[0] + 5 * Math.log10(r * delta) + m[1] * phase + m[2] * phase * phase
                    + m[3] * phase * phase * phase;

            HorizontalPoint hp = Coordinates.equatorialToHorizontal(planet.ra, planet.dec, observer);
            planet.azimuth = hp.azimuth;
            planet.altitude = hp.altitude;
            planets.add(planet);
        }
        return planets;
    }

    // --- SOL ---
    static CelestialPoint sunEquatorial(double jd) {
        double n = jd - J2000;
        double lambda = sunEclipticLongitude(jd);
        double eps = Math.toRadians(23.439 - 0.0000004 * n);
        return eclipticToEquatorial(lambda, 0, eps);
    }

    static double sunEclipticLongitude(double jd) {
        double n = jd - J2000;
        double l = 280.460 + 0.9856474 * n;
        double g = Math.toRadians(357.528 + 0.9856003 * n);
        return Coordinates.mod2pi(Math.toRadians(l + 1.915 * Math.sin(g) + 0.020 * Math.sin(2 * g)));
    }

    static double sunDistanceAu(double jd) {
        double g = Math.toRadians(357.528 + 0.9856003 * (jd - J2000));
        return 1.00014 - 0.01671 * Math.cos(g) - 0.00014 * Math.cos(2 * g);
    }

    // --- LUNA ---
    // Longitud, latitud ecliptica y paralaje horizontal, en rad.
    static double[] moonEcliptic(double jd) {
        double t = (jd - J2000) / 36525.0;
        double lambda = 218.32 + 481267.881 * t
                + 6.29 * sind(135.0 + 477198.87 * t) - 1.27 * sind(259.3 - 413335.36 * t)
                + 0.66 * sind(235.7 + 890534.22 * t) + 0.21 * sind(269.9 + 954397.74 * t)
                - 0.19 * sind(357.5 + 35999.05 * t) - 0.11 * sind(186.5 + 966404.03 * t);
        double beta = 5.13 * sind(93.3 + 483202.02 * t) + 0.28 * sind(228.2 + 960400.89 * t)
                - 0.28 * sind(318.3 + 6003.15 * t) - 0.17 * sind(217.6 - 407332.21 * t);
        double parallax = 0.9508 + 0.0518 * cosd(135.0 + 477198.87 * t) + 0.0095 * cosd(259.3 - 413335.36 * t)
                + 0.0078 * cosd(235.7 + 890534.22 * t) + 0.0028 * cosd(269.9 + 954397.74 * t);
        return new double[]{
            Coordinates.mod2pi(Math.toRadians(lambda)), Math.toRadians(beta), Math.toRadians(parallax)
        };
    }

    // --- PLANETAS ---
    // Posicion heliocentrica ecliptica J2000 en UA.
    static double[] heliocentric(double[] el, double t) {
        double a = el[0] + el[1] * t;
        double e = el[2] + el[3] * t;
        double inc = Math.toRadians(el[4] + el[5] * t);
        double meanLon = el[6] + el[7] * t;
        double periLon = el[8] + el[9] * t;
        double node = el[10] + el[11] * t;

        double omega = Math.toRadians(periLon - node);
        double nodeRad = Math.toRadians(node);
        double meanAnomaly = Math.toRadians(((meanLon - periLon) % 360 + 540) % 360 - 180);
        double ecc = solveKepler(meanAnomaly, e);

        double xp = a * (Math.cos(ecc) - e);
        double yp = a * Math.sqrt(1 - e * e) * Math.sin(ecc);

        double cw = Math.cos(omega), sw = Math.sin(omega);
        double cn = Math.cos(nodeRad), sn = Math.sin(nodeRad);
        double ci = Math.cos(inc), si = Math.sin(inc);
        return new double[]{
            (cw * cn - sw * sn * ci) * xp + (-sw * cn - cw * sn * ci) * yp,
            (cw * sn + sw * cn * ci) * xp + (-sw * sn + cw * cn * ci) * yp,
            (sw * si) * xp + (cw * si) * yp
        };
    }

    static double solveKepler(double meanAnomaly, double e) {
        double ecc = meanAnomaly + e * Math.sin(meanAnomaly);
        for (int i = 0; i < 30; i++) {
            double delta = (ecc - e * Math.sin(ecc) - meanAnomaly) / (1 - e * Math.cos(ecc));
            ecc -= delta;
            if (Math.abs(delta) < 1e-12) break;
        }
        return ecc;
    }

    static CelestialPoint eclipticToEquatorial(double lambda, double beta, double eps) {
        double ra = Math.atan2(Math.sin(lambda) * Math.cos(eps) - Math.tan(beta) * Math.sin(eps), Math.cos(lambda));
        double dec = Math.asin(Math.sin(beta) * Math.cos(eps) + Math.cos(beta) * Math.sin(eps) * Math.sin(lambda));
        return new CelestialPoint(Coordinates.mod2pi(ra), dec);
    }

    private static double norm(double[] v) {
        return Math.sqrt(v[0] * v[0] + v[1] * v[1] + v[2] * v[2]);
    }

    private static double sind(double deg) {
        return Math.sin(Math.toRadians(deg));
    }

    private static double cosd(double deg) {
        return Math.cos(Math.toRadians(deg));
    }
}
