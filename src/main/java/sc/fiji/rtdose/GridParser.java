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
import java.util.List;

/**
 * Builds a {@link ScalarField3D} from the dose grid of a planning system, checking the axes as it goes.
 * Two input shapes are accepted: axis vectors with a value cube indexed [x][y][z], and the
 * long table of (X, Y, Z, Dose) rows written by Eyeplan.
 * @author Andre Faubert 2024-04
 */
public final class GridParser {
    private static final String[] AXIS_NAMES = {"X", "Y", "Z"};

    private GridParser() {
    }

    /**
     * Build a field from axis vectors and a value cube. An axis listed in descending order is reversed,
     * and the cube is reindexed with it, so the field always has ascending axes.
     * @param axisX     The x coordinates, ascending or descending.
     * @param axisY     The y coordinates, ascending or descending.
     * @param axisZ     The z coordinates, ascending or descending.
     * @param values    Doses indexed [x][y][z].
     * @param doseUnits The DICOM dose unit of the values, or null for {@value ScalarField3D#DEFAULT_DOSE_UNITS}.
     * @return          The validated field.
     * @throws MalformedGridException   When an axis is degenerate, has duplicates or changes direction,
     *                                  when the cube does not match the axes, or a dose is negative or not finite.
     */
    public static ScalarField3D fromAxes(double[] axisX, double[] axisY, double[] axisZ,
                                         double[][][] values, String doseUnits) throws MalformedGridException {
        boolean descX = checkAxis(0, axisX);
        boolean descY = checkAxis(1, axisY);
        boolean descZ = checkAxis(2, axisZ);
        int nx = axisX.length, ny = axisY.length, nz = axisZ.length;

        if (values == null || values.length != nx)
            throw new MalformedGridException("The value cube has " + (values == null ? 0 : values.length)
                    + " planes along X but the X axis has " + nx + " coordinates.");
        double[] flat = new double[nx * ny * nz];
        for (int i = 0; i < nx; i++) {
            if (values[i] == null || values[i].length != ny)
                throw new MalformedGridException("The value cube's X plane " + i + " does not have "
                        + ny + " rows along Y.");
            int ti = descX ? nx - 1 - i : i;
            for (int j = 0; j < ny; j++) {
                if (values[i][j] == null || values[i][j].length != nz)
                    throw new MalformedGridException("The value cube's row (" + i + ", " + j + ") does not have "
                            + nz + " values along Z.");
                int tj = descY ? ny - 1 - j : j;
                for (int k = 0; k < nz; k++) {
                    double v = values[i][j][k];
                    checkDose(v, axisX[i], axisY[j], axisZ[k]);
                    int tk = descZ ? nz - 1 - k : k;
                    flat[(tk * ny + tj) * nx + ti] = v;
                }
            }
        }
        return new ScalarField3D(ascending(axisX, descX), ascending(axisY, descY), ascending(axisZ, descZ),
                flat, doseUnits);
    }

    /**
     * Pivot an Eyeplan table into a field. Every combination of the distinct X, Y and Z coordinates must be
     * listed exactly once.
     * @param table     The rows read from the workbook.
     * @param mapping   How the Eyeplan columns map onto patient axes.
     * @param doseUnits The DICOM dose unit of the values, or null for {@value ScalarField3D#DEFAULT_DOSE_UNITS}.
     * @return          The validated field, in patient axis order.
     * @throws MalformedGridException   When the rows do not form a complete lattice, or a value is invalid.
     */
    public static ScalarField3D fromTable(EyeplanDoseTable table, AxisMapping mapping, String doseUnits)
            throws MalformedGridException {
        List<DosePoint> points = table.getPoints();
        if (points.isEmpty()) throw new MalformedGridException("The dose table contains no rows.");

        double[][] coords = new double[points.size()][];
        for (int p = 0; p < coords.length; p++) {
            coords[p] = mapping.toPatient(points.get(p));
            for (int a = 0; a < 3; a++) {
                if (!Double.isFinite(coords[p][a]))
                    throw new MalformedGridException("Row " + (p + 1) + " has a missing or invalid "
                            + AXIS_NAMES[a] + " coordinate.");
                coords[p][a] += 0.0;  // Folds -0.0 into 0.0 so both land on the same coordinate.
            }
        }

        double[][] axes = new double[3][];
        for (int a = 0; a < 3; a++) {
            final int axis = a;
            axes[a] = Arrays.stream(coords).mapToDouble(c -> c[axis]).sorted().distinct().toArray();
            if (axes[a].length < 2)
                throw new MalformedGridException("The " + AXIS_NAMES[a] + " axis has " + axes[a].length
                        + " distinct coordinate(s); at least 2 are required.");
        }
        int nx = axes[0].length, ny = axes[1].length, nz = axes[2].length;
        long expected = (long) nx * ny * nz;
        if (expected > Integer.MAX_VALUE)
            throw new MalformedGridException("The dose grid is too large: " + nx + "x" + ny + "x" + nz + ".");

        double[] flat = new double[(int) expected];
        boolean[] seen = new boolean[flat.length];
        for (int p = 0; p < coords.length; p++) {
            double[] c = coords[p];
            int i = Arrays.binarySearch(axes[0], c[0]);
            int j = Arrays.binarySearch(axes[1], c[1]);
            int k = Arrays.binarySearch(axes[2], c[2]);
            int index = (k * ny + j) * nx + i;
            if (seen[index])
                throw new MalformedGridException("The point (" + c[0] + ", " + c[1] + ", " + c[2]
                        + ") is listed more than once.");
            double dose = points.get(p).dose;
            checkDose(dose, c[0], c[1], c[2]);
            seen[index] = true;
            flat[index] = dose;
        }
        if (points.size() != expected) {
            for (int index = 0; index < seen.length; index++) {
                if (seen[index]) continue;
                int i = index % nx, j = (index / nx) % ny, k = index / (nx * ny);
                throw new MalformedGridException("The dose grid has no value at (" + axes[0][i] + ", "
                        + axes[1][j] + ", " + axes[2][k] + "); " + points.size() + " of " + expected
                        + " points were listed.");
            }
        }
        return new ScalarField3D(axes[0], axes[1], axes[2], flat, doseUnits);
    }

    /**
     * @return  True when the axis is strictly descending, false when strictly ascending.
     * @throws MalformedGridException   Otherwise.
     */
    static boolean checkAxis(int axis, double[] coords) throws MalformedGridException {
        String name = AXIS_NAMES[axis];
        if (coords == null || coords.length < 2)
            throw new MalformedGridException("The " + name + " axis needs at least 2 coordinates, found "
                    + (coords == null ? 0 : coords.length) + ".");
        for (int i = 0; i < coords.length; i++)
            if (!Double.isFinite(coords[i]))
                throw new MalformedGridException("The " + name + " axis coordinate " + i + " is not finite.");
        boolean descending = coords[1] < coords[0];
        for (int i = 1; i < coords.length; i++) {
            double step = coords[i] - coords[i - 1];
            if (step == 0)
                throw new MalformedGridException("The " + name + " axis lists the coordinate " + coords[i]
                        + " more than once.");
            if ((step < 0) != descending)
                throw new MalformedGridException("The " + name + " axis is not monotonic at index " + i
                        + " (" + coords[i - 1] + " then " + coords[i] + ").");
        }
        return descending;
    }

    private static double[] ascending(double[] coords, boolean descending) {
        double[] sorted = new double[coords.length];
        for (int i = 0; i < coords.length; i++)
            sorted[i] = descending ? coords[coords.length - 1 - i] : coords[i];
        return sorted;
    }

    private static void checkDose(double dose, double x, double y, double z) throws MalformedGridException {
        if (!Double.isFinite(dose) || dose < 0)
            throw new MalformedGridException("Invalid dose " + dose + " at (" + x + ", " + y + ", " + z
                    + "); doses must be finite and non-negative.");
    }
}
