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

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Quantizes resampled doses into unsigned integers with a single scale factor.
 *
 * The scale factor is the largest dose divided by the largest integer, raised to the precision floor if below it,
 * then rounded up to {@value #SCALE_DIGITS} significant digits so that it survives being written as a decimal string.
 * An all-zero volume has a scale factor of 1.
 * @author Andre Faubert 2024-04
 */
public class DoseEncoder {
    public static final int SCALE_DIGITS = 10;

    private final EncodingOptions options;

    public DoseEncoder(EncodingOptions options) {
        this.options = options;
    }

    public EncodingOptions getOptions() {
        return options;
    }

    public EncodedDoseVolume encode(ResampledDoseVolume volume) throws EncodingRangeException {
        PixelWidth width = options.getPixelWidth();
        long maxInt = width.maxValue();
        double threshold = options.getZeroThreshold();

        double max = 0;
        for (int p = 0; p < volume.length(); p++) {
            double v = volume.get(p);
            if (v >= threshold && v > max) max = v;
        }

        int[] raw = new int[volume.length()];
        if (max <= 0) {
            return new EncodedDoseVolume(volume.getSize(), raw, width, 1.0, volume.getDoseUnits());
        }
        double scale = scaleFactor(max, maxInt, options.getPrecisionFloor());
        for (int p = 0; p < raw.length; p++) {
            double v = volume.get(p);
            if (v < threshold) continue;
            long r = Math.round(v / scale);
            if (r < 0) r = 0;
            if (r > maxInt) r = maxInt;
            raw[p] = (int) r;
        }
        checkRange(raw, width);
        return new EncodedDoseVolume(volume.getSize(), raw, width, scale, volume.getDoseUnits());
    }

    /**
     * @return  The smallest {@value #SCALE_DIGITS}-digit decimal, no smaller than `floor`, that maps `max` to at most `maxInt`.
     */
    static double scaleFactor(double max, long maxInt, double floor) {
        double scale = Math.max(max / maxInt, floor);
        return BigDecimal.valueOf(scale).round(new MathContext(SCALE_DIGITS, RoundingMode.CEILING)).doubleValue();
    }

    /**
     * @throws EncodingRangeException   When a value, read as unsigned, does not fit the pixel width.
     */
    static void checkRange(int[] raw, PixelWidth width) throws EncodingRangeException {
        long maxInt = width.maxValue();
        for (int p = 0; p < raw.length; p++) {
            long r = Integer.toUnsignedLong(raw[p]);
            if (r > maxInt)
                throw new EncodingRangeException("Encoded value " + r + " at voxel " + p + " exceeds the "
                        + width.bits + "-bit maximum of " + maxInt + ".");
        }
    }
}
