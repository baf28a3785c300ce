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

/**
 * Parameters of {@link DoseEncoder}.
 */
public class EncodingOptions {
    // Eyeplan exports carry numerical noise below this many Gy. Zeroing it is opt-in, since
    // it widens the quantization error for volumes whose scale factor is smaller.
    public static final double EYEPLAN_NOISE_FLOOR = 1e-11;
    public static final double DEFAULT_ZERO_THRESHOLD = 0;
    // The smallest scale factor that will be used, so that tiny maxima do not produce a meaningless scale.
    public static final double DEFAULT_PRECISION_FLOOR = 1e-12;

    private final PixelWidth pixelWidth;
    private final double zeroThreshold;
    private final double precisionFloor;

    public EncodingOptions(PixelWidth pixelWidth, double zeroThreshold, double precisionFloor) {
        if (pixelWidth == null) throw new IllegalArgumentException("pixelWidth must not be null");
        if (!(zeroThreshold >= 0) || !Double.isFinite(zeroThreshold))
            throw new IllegalArgumentException("The zero threshold must be finite and non-negative: " + zeroThreshold);
        if (!(precisionFloor > 0) || !Double.isFinite(precisionFloor))
            throw new IllegalArgumentException("The precision floor must be finite and positive: " + precisionFloor);
        this.pixelWidth = pixelWidth;
        this.zeroThreshold = zeroThreshold;
        this.precisionFloor = precisionFloor;
    }

    public static EncodingOptions defaults() {
        return new EncodingOptions(PixelWidth.UINT32, DEFAULT_ZERO_THRESHOLD, DEFAULT_PRECISION_FLOOR);
    }

    public PixelWidth getPixelWidth() {
        return pixelWidth;
    }

    public double getZeroThreshold() {
        return zeroThreshold;
    }

    public double getPrecisionFloor() {
        return precisionFloor;
    }

    public String toString() {
        return "EncodingOptions(pixelWidth=" + pixelWidth
                + ", zeroThreshold=" + zeroThreshold
                + ", precisionFloor=" + precisionFloor
                + ")";
    }
}
