package com.skycam.service;

import com.skycam.model.CropMask;
import ij.process.FloatProcessor;
import java.util.Locale;

// Funcion de respuesta usada para localizar estrellas. Todas las rejillas se recortan a
// valores no negativos y llevan NaN en los pixeles recortados.
public enum ResponseFunction {

    // Gradiente, Sobel y LoG; la deteccion usa LoG, los otros dos son diagnostico.
    ALL("All") {
        @Override
        FloatProcessor detectionSignal(FloatProcessor img, double kernel) {
            return LOG.detectionSignal(img, kernel);
        }

        @Override
        public Grids compute(FloatProcessor img, double kernel, CropMask mask) {
            FloatProcessor grad = finish(GRAD.detectionSignal(img, kernel), mask);
            FloatProcessor sobel = finish(SOBEL.detectionSignal(img, kernel), mask);
            FloatProcessor lap = finish(detectionSignal(img, kernel), mask);
            return new Grids(lap, grad, sobel);
        }
    },

    DOG("DoG") {
        @Override
        FloatProcessor detectionSignal(FloatProcessor img, double kernel) {
            return ImageFilters.difference(ImageFilters.gaussian(img, kernel), ImageFilters.gaussian(img, 1.6 * kernel));
        }
    },

    LOG("LoG") {
        @Override
        FloatProcessor detectionSignal(FloatProcessor img, double kernel) {
            return ImageFilters.laplace(ImageFilters.gaussian(img, kernel));
        }
    },

    GRAD("Grad") {
        @Override
        FloatProcessor detectionSignal(FloatProcessor img, double kernel) {
            return ImageFilters.squaredGradient(img);
        }
    },

    SOBEL("Sobel") {
        @Override
        FloatProcessor detectionSignal(FloatProcessor img, double kernel) {
            return ImageFilters.sobel(img);
        }
    };

    // Rejillas de respuesta de una imagen; gradient y sobel solo existen con ALL.
    public static class Grids {
        public final FloatProcessor response;
        public final FloatProcessor gradient;
        public final FloatProcessor sobel;

        public Grids(FloatProcessor response, FloatProcessor gradient, FloatProcessor sobel) {
            this.response = response;
            this.gradient = gradient;
            this.sobel = sobel;
        }

        public boolean hasDiagnostics() {
            return gradient != null && sobel != null;
        }
    }

    private final String label;

    ResponseFunction(String label) {
        this.label = label;
    }

    abstract FloatProcessor detectionSignal(FloatProcessor img, double kernel);

    // img sin NaN (ver ImageFilters.fillMasked), kernel = sigma de la gaussiana
    public Grids compute(FloatProcessor img, double kernel, CropMask mask) {
        return new Grids(finish(detectionSignal(img, kernel), mask), null, null);
    }

    public String label() {
        return label;
    }

    static FloatProcessor finish(FloatProcessor response, CropMask mask) {
        ImageFilters.clipNegative(response);
        if (mask != null) ImageFilters.maskNaN(response, mask);
        return response;
    }

    public static ResponseFunction fromName(String name) {
        if (name != null) {
            for (ResponseFunction f : values()) {
                if (f.label.toLowerCase(Locale.ROOT).equals(name.trim().toLowerCase(Locale.ROOT))) return f;
            }
        }
        throw new IllegalArgumentException("Function name: '" + name + "' is unknown");
    }
}
