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

import java.util.Arrays;

/**
 * Doses on the reference voxel lattice, stored with x varying fastest, then y, then frame,
 * which is the order of DICOM pixel data.
 */
public class ResampledDoseVolume {
    private final int[] size;
    private final double[] values;
    private final String doseUnits;

    ResampledDoseVolume(int[] size, double[] values, String doseUnits) {
        if (values.length != size[0] * size[1] * size[2])
            throw new IllegalArgumentException("Expected " + size[0] * size[1] * size[2] + " values, got " + values.length);
        this.size = size.clone();
        this.values = values;
        this.doseUnits = doseUnits;
    }

    /**
     * Wrap doses computed elsewhere. The array is copied.
     */
    public static ResampledDoseVolume of(int[] size, double[] values, String doseUnits) {
        return new ResampledDoseVolume(size, values.clone(), doseUnits);
    }

    public int[] getSize() {
        return size.clone();
    }

    public int sizeX() {
        return size[0];
    }

    public int sizeY() {
        return size[1];
    }

    public int sizeZ() {
        return size[2];
    }

    public int length() {
        return values.length;
    }

    public double get(int i, int j, int k) {
        return values[(k * size[1] + j) * size[0] + i];
    }

    public double get(int index) {
        return values[index];
    }

    public String getDoseUnits() {
        return doseUnits;
    }

    /**
     * @return  A copy of the doses of frame k, as a float array suitable for an ImageJ FloatProcessor.
     */
    public float[] frame(int k) {
        int n = size[0] * size[1];
        float[] pixels = new float[n];
        for (int p = 0; p < n; p++)
            pixels[p] = (float) values[k * n + p];
        return pixels;
    }

    public double max() {
        double max = 0;
        for (double v : values)
            if (v > max) max = v;
        return max;
    }

    public String toString() {
        return "ResampledDoseVolume(size=" + Arrays.toString(size) + ", max=" + max() + ", doseUnits=" + doseUnits + ")";
    }
}
