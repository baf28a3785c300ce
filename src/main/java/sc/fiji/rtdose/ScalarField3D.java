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
 * A dose distribution sampled on a rectilinear lattice. The three axes are strictly increasing
 * positions in millimetres and the values are stored with X varying fastest, then Y, then Z.
 * Instances are created by {@link GridParser}, which validates the axes, and are never modified.
 */
public class ScalarField3D {
    public static final String DEFAULT_DOSE_UNITS = "GY";

    private final double[] axisX;
    private final double[] axisY;
    private final double[] axisZ;
    private final double[] values;
    private final String doseUnits;

    ScalarField3D(double[] axisX, double[] axisY, double[] axisZ, double[] values, String doseUnits) {
        this.axisX = axisX;
        this.axisY = axisY;
        this.axisZ = axisZ;
        this.values = values;
        this.doseUnits = doseUnits == null ? DEFAULT_DOSE_UNITS : doseUnits;
    }

    public int sizeX() {
        return axisX.length;
    }

    public int sizeY() {
        return axisY.length;
    }

    public int sizeZ() {
        return axisZ.length;
    }

    public double[] getAxisX() {
        return axisX.clone();
    }

    public double[] getAxisY() {
        return axisY.clone();
    }

    public double[] getAxisZ() {
        return axisZ.clone();
    }

    /**
     * @param axis  0, 1 or 2 for X, Y or Z.
     * @return      The coordinates of that axis. The array is shared and must not be modified.
     */
    double[] axis(int axis) {
        switch (axis) {
            case 0: return axisX;
            case 1: return axisY;
            case 2: return axisZ;
            default: throw new IllegalArgumentException("Axis index must be 0, 1 or 2: " + axis);
        }
    }

    /**
     * @return  The flat value array, shared with this field.
     */
    double[] values() {
        return values;
    }

    public int index(int i, int j, int k) {
        return (k * axisY.length + j) * axisX.length + i;
    }

    public double getValue(int i, int j, int k) {
        return values[index(i, j, k)];
    }

    public double maxValue() {
        double max = 0;
        for (double v : values)
            if (v > max) max = v;
        return max;
    }

    /**
     * @return  The unit of the dose values, as a DICOM Dose Units code.
     */
    public String getDoseUnits() {
        return doseUnits;
    }

    public String toString() {
        return "ScalarField3D(size=" + sizeX() + "x" + sizeY() + "x" + sizeZ()
                + ", x=[" + axisX[0] + ", " + axisX[axisX.length - 1] + "]"
                + ", y=[" + axisY[0] + ", " + axisY[axisY.length - 1] + "]"
                + ", z=[" + axisZ[0] + ", " + axisZ[axisZ.length - 1] + "]"
                + ", doseUnits=" + doseUnits
                + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalarField3D)) return false;
        ScalarField3D that = (ScalarField3D) o;
        return Arrays.equals(axisX, that.axisX) && Arrays.equals(axisY, that.axisY)
                && Arrays.equals(axisZ, that.axisZ) && Arrays.equals(values, that.values)
                && doseUnits.equals(that.doseUnits);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(axisX);
        result = 31 * result + Arrays.hashCode(axisY);
        result = 31 * result + Arrays.hashCode(axisZ);
        result = 31 * result + Arrays.hashCode(values);
        return 31 * result + doseUnits.hashCode();
    }
}
