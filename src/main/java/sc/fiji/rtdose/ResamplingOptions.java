/*-
 * #%L
 * Eyeplan RT Dose plugin for Fiji.
 * %%
 * Copyright (C) 2008 - 2024 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */
package sc.fiji.rtdose;

import ij.Prefs;

/**
 * Parameters of {@link TrilinearResampler}.
 */
public class ResamplingOptions {
    /** What to do with reference voxels that lie outside the source dose field. */
    public enum Extrapolation {
        /** Use the nearest boundary value of the field. */
        CLAMP,
        /** Fail with an {@link ExtrapolationException}. */
        ERROR
    }

    // Millimetres. Well below the 0.1 mm spacing of an Eyeplan grid and above the rounding of its coordinates.
    public static final double DEFAULT_TOLERANCE = 1e-4;

    private final Extrapolation extrapolation;
    private final double toleranceEpsilon;
    private final int threads;

    public ResamplingOptions(Extrapolation extrapolation, double toleranceEpsilon, int threads) {
        if (extrapolation == null) throw new IllegalArgumentException("extrapolation must not be null");
        if (!(toleranceEpsilon >= 0) || !Double.isFinite(toleranceEpsilon))
            throw new IllegalArgumentException("The tolerance must be finite and non-negative: " + toleranceEpsilon);
        if (threads < 1) throw new IllegalArgumentException("At least one thread is needed: " + threads);
        this.extrapolation = extrapolation;
        this.toleranceEpsilon = toleranceEpsilon;
        this.threads = threads;
    }

    /**
     * Clamp at the field boundary, with the default tolerance and the thread count set in ImageJ's preferences.
     */
    public static ResamplingOptions defaults() {
        return new ResamplingOptions(Extrapolation.CLAMP, DEFAULT_TOLERANCE, Prefs.getThreads());
    }

    public Extrapolation getExtrapolation() {
        return extrapolation;
    }

    public double getToleranceEpsilon() {
        return toleranceEpsilon;
    }

    public int getThreads() {
        return threads;
    }

    public ResamplingOptions withThreads(int threads) {
        return new ResamplingOptions(extrapolation, toleranceEpsilon, threads);
    }

    public String toString() {
        return "ResamplingOptions(extrapolation=" + extrapolation
                + ", toleranceEpsilon=" + toleranceEpsilon
                + ", threads=" + threads
                + ")";
    }
}
