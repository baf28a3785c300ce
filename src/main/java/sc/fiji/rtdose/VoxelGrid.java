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
 * The voxel lattice of the reference dose volume, in patient coordinates (millimetres).
 * The origin is the center of voxel (0, 0, 0); index i runs along the row direction, j along the
 * column direction and k across frames. Instances are immutable.
 */
public class VoxelGrid {
    public static final double[] UNIT_X = {1, 0, 0};
    public static final double[] UNIT_Y = {0, 1, 0};
    public static final double[] UNIT_Z = {0, 0, 1};
    // Doses are held in one array, and 32-bit pixel data in one byte array.
    public static final int MAX_VOXELS = (Integer.MAX_VALUE - 8) / 4;

    private final double[] origin;
    private final double[] spacing;
    private final int[] size;
    private final double[][] directions;

    /**
     * An axis-aligned grid.
     */
    public VoxelGrid(double[] origin, double[] spacing, int[] size) {
        this(origin, spacing, size, new double[][] {UNIT_X, UNIT_Y, UNIT_Z});
    }

    public VoxelGrid(double[] origin, double[] spacing, int[] size, double[][] directions) {
        if (origin.length != 3 || spacing.length != 3 || size.length != 3 || directions.length != 3)
            throw new IllegalArgumentException("A voxel grid needs 3 coordinates for origin, spacing, size and directions.");
        for (int a = 0; a < 3; a++) {
            if (!(spacing[a] > 0) || !Double.isFinite(spacing[a]))
                throw new IllegalArgumentException("Spacing must be positive and finite: " + Arrays.toString(spacing));
            if (size[a] <= 0)
                throw new IllegalArgumentException("Voxel counts must be positive: " + Arrays.toString(size));
            if (!Double.isFinite(origin[a]))
                throw new IllegalArgumentException("The origin must be finite: " + Arrays.toString(origin));
        }
        if ((long) size[0] * size[1] * size[2] > MAX_VOXELS)
            throw new IllegalArgumentException("A voxel grid holds at most " + MAX_VOXELS + " voxels: "
                    + Arrays.toString(size));
        this.origin = origin.clone();
        this.spacing = spacing.clone();
        this.size = size.clone();
        this.directions = new double[3][];
        for (int a = 0; a < 3; a++)
            this.directions[a] = directions[a].clone();
    }

    public double[] getOrigin() {
        return origin.clone();
    }

    public double[] getSpacing() {
        return spacing.clone();
    }

    public int[] getSize() {
        return size.clone();
    }

    public double[] getDirection(int axis) {
        return directions[axis].clone();
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

    public int voxelCount() {
        return size[0] * size[1] * size[2];
    }

    /**
     * @return  The patient position of the center of voxel (i, j, k).
     */
    public double[] position(int i, int j, int k) {
        double[] p = origin.clone();
        int[] index = {i, j, k};
        for (int a = 0; a < 3; a++)
            for (int d = 0; d < 3; d++)
                p[d] += index[a] * spacing[a] * directions[a][d];
        return p;
    }

    /**
     * @return  The patient axis (0, 1 or 2) that grid `axis` runs along, either way, or -1 when its
     *          direction is not a standard basis vector.
     */
    public int patientAxis(int axis) {
        double[] direction = directions[axis];
        for (int d = 0; d < 3; d++) {
            if (!(Math.abs(Math.abs(direction[d]) - 1) <= ReferenceGeometryReader.ORIENTATION_TOLERANCE)) continue;
            for (int e = 0; e < 3; e++)
                if (e != d && !(Math.abs(direction[e]) <= ReferenceGeometryReader.ORIENTATION_TOLERANCE))
                    return -1;
            return d;
        }
        return -1;
    }

    /**
     * @return  True when the three grid axes run along three different patient axes.
     */
    public boolean isAxisAligned() {
        int x = patientAxis(0), y = patientAxis(1), z = patientAxis(2);
        return x >= 0 && y >= 0 && z >= 0 && x != y && y != z && x != z;
    }

    /**
     * For an axis-aligned grid, the coordinate of every voxel layer on grid `axis`, measured on the
     * patient axis it runs along. The coordinates decrease when the grid axis points the negative way.
     */
    public double[] axisCoordinates(int axis) {
        int d = patientAxis(axis);
        if (d < 0)
            throw new IllegalStateException("Grid axis " + axis + " is not axis aligned: "
                    + Arrays.toString(directions[axis]));
        double step = spacing[axis] * Math.signum(directions[axis][d]);
        double[] coords = new double[size[axis]];
        for (int n = 0; n < coords.length; n++)
            coords[n] = origin[d] + n * step;
        return coords;
    }

    /**
     * @return  The offsets of each frame relative to the first, as stored in Grid Frame Offset Vector.
     */
    public double[] frameOffsets() {
        double[] offsets = new double[size[2]];
        for (int k = 0; k < offsets.length; k++)
            offsets[k] = k * spacing[2];
        return offsets;
    }

    public String toString() {
        return "VoxelGrid(origin=" + Arrays.toString(origin)
                + ", spacing=" + Arrays.toString(spacing)
                + ", size=" + Arrays.toString(size)
                + ", directions=" + Arrays.deepToString(directions)
                + ")";
    }
}
