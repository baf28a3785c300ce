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

import ij.IJ;
import ij.Prefs;

import java.util.Arrays;

/**
 * Everything a conversion can be tuned with. The plugin keeps these in ImageJ's preferences
 * under the "rtdose." prefix; the command line builds them from its flags.
 */
public class ConversionOptions {
    public static final String PREFS_PREFIX = "rtdose.";
    static final String KEY_EXTRAPOLATION = PREFS_PREFIX + "extrapolation";
    static final String KEY_TOLERANCE = PREFS_PREFIX + "tolerance";
    static final String KEY_BITS = PREFS_PREFIX + "bits";
    static final String KEY_ZERO_THRESHOLD = PREFS_PREFIX + "zeroThreshold";
    static final String KEY_PRECISION_FLOOR = PREFS_PREFIX + "precisionFloor";
    static final String KEY_AXIS_MAPPING = PREFS_PREFIX + "axisMapping";
    static final String KEY_DOSE_UNITS = PREFS_PREFIX + "doseUnits";

    public static final String[] DOSE_UNITS = {"GY", "RELATIVE"};

    private final ResamplingOptions resampling;
    private final EncodingOptions encoding;
    private final AxisMapping axisMapping;
    private final String doseUnits;

    public ConversionOptions(ResamplingOptions resampling, EncodingOptions encoding, AxisMapping axisMapping,
                             String doseUnits) {
        if (!Arrays.asList(DOSE_UNITS).contains(doseUnits))
            throw new IllegalArgumentException("Dose units must be one of " + Arrays.toString(DOSE_UNITS)
                    + ", not " + doseUnits);
        this.resampling = resampling;
        this.encoding = encoding;
        this.axisMapping = axisMapping;
        this.doseUnits = doseUnits;
    }

    public static ConversionOptions defaults() {
        return new ConversionOptions(ResamplingOptions.defaults(), EncodingOptions.defaults(), AxisMapping.EYEPLAN,
                ScalarField3D.DEFAULT_DOSE_UNITS);
    }

    /**
     * Read the options last saved with {@link #saveToPrefs()}. Unreadable entries fall back to the defaults.
     */
    public static ConversionOptions fromPrefs() {
        ConversionOptions d = defaults();
        ResamplingOptions.Extrapolation extrapolation = d.resampling.getExtrapolation();
        try {
            extrapolation = ResamplingOptions.Extrapolation.valueOf(Prefs.get(KEY_EXTRAPOLATION, extrapolation.name()));
        } catch (IllegalArgumentException e) {
            ignoredPref(KEY_EXTRAPOLATION, e);
        }
        AxisMapping mapping = d.axisMapping;
        try {
            mapping = AxisMapping.valueOf(Prefs.get(KEY_AXIS_MAPPING, mapping.name()));
        } catch (IllegalArgumentException e) {
            ignoredPref(KEY_AXIS_MAPPING, e);
        }
        PixelWidth width = d.encoding.getPixelWidth();
        try {
            width = PixelWidth.fromBits((int) Prefs.get(KEY_BITS, width.bits));
        } catch (IllegalArgumentException e) {
            ignoredPref(KEY_BITS, e);
        }
        double tolerance = Prefs.get(KEY_TOLERANCE, d.resampling.getToleranceEpsilon());
        double zeroThreshold = Prefs.get(KEY_ZERO_THRESHOLD, d.encoding.getZeroThreshold());
        double precisionFloor = Prefs.get(KEY_PRECISION_FLOOR, d.encoding.getPrecisionFloor());
        if (!(tolerance >= 0)) tolerance = d.resampling.getToleranceEpsilon();
        if (!(zeroThreshold >= 0)) zeroThreshold = d.encoding.getZeroThreshold();
        if (!(precisionFloor > 0)) precisionFloor = d.encoding.getPrecisionFloor();
        String units = Prefs.get(KEY_DOSE_UNITS, d.doseUnits);
        if (!Arrays.asList(DOSE_UNITS).contains(units)) {
            if (IJ.debugMode) IJ.log("Ignoring the preference " + KEY_DOSE_UNITS + ": " + units);
            units = d.doseUnits;
        }
        return new ConversionOptions(
                new ResamplingOptions(extrapolation, tolerance, d.resampling.getThreads()),
                new EncodingOptions(width, zeroThreshold, precisionFloor),
                mapping, units);
    }

    private static void ignoredPref(String key, IllegalArgumentException e) {
        if (IJ.debugMode) IJ.log("Ignoring the preference " + key + ": " + e.getMessage());
    }

    public void saveToPrefs() {
        Prefs.set(KEY_EXTRAPOLATION, resampling.getExtrapolation().name());
        Prefs.set(KEY_TOLERANCE, resampling.getToleranceEpsilon());
        Prefs.set(KEY_BITS, encoding.getPixelWidth().bits);
        Prefs.set(KEY_ZERO_THRESHOLD, encoding.getZeroThreshold());
        Prefs.set(KEY_PRECISION_FLOOR, encoding.getPrecisionFloor());
        Prefs.set(KEY_AXIS_MAPPING, axisMapping.name());
        Prefs.set(KEY_DOSE_UNITS, doseUnits);
    }

    public ResamplingOptions getResampling() {
        return resampling;
    }

    public EncodingOptions getEncoding() {
        return encoding;
    }

    public AxisMapping getAxisMapping() {
        return axisMapping;
    }

    public String getDoseUnits() {
        return doseUnits;
    }

    public String toString() {
        return "ConversionOptions(" + resampling
                + ", " + encoding
                + ", axisMapping=" + axisMapping
                + ", doseUnits=" + doseUnits
                + ")";
    }
}
