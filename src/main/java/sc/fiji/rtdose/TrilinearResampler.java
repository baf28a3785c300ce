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

import ij.util.ThreadUtil;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resamples a {@link ScalarField3D} onto the voxel centers of a {@link VoxelGrid} by trilinear interpolation.
 *
 * Because the reference grid is axis aligned, each grid axis runs along one patient axis, possibly backwards,
 * and the bracketing source cell on that patient axis depends only on the voxel's index along the grid axis.
 * The brackets are found once per axis by binary search, then the volume is blended frame by frame on worker
 * threads, each writing only the frames it claims.
 * @author Andre Faubert 2024-04
 */
public class TrilinearResampler {
    private static final String[] AXIS_NAMES = {"x", "y", "z"};

    private final ResamplingOptions options;

    public TrilinearResampler(ResamplingOptions options) {
        this.options = options;
    }

    public ResamplingOptions getOptions() {
        return options;
    }

    /**
     * @return  The doses at every voxel center of `grid`, in the shape of `grid`.
     * @throws MalformedGridException   When an axis of the field has fewer than 2 coordinates.
     * @throws ExtrapolationException   When a voxel lies outside the field and extrapolation is disabled.
     * @throws IllegalArgumentException When a grid axis does not run along a patient axis.
     */
    public ResampledDoseVolume resample(ScalarField3D field, VoxelGrid grid)
            throws MalformedGridException, ExtrapolationException {
        if (!grid.isAxisAligned())
            throw new IllegalArgumentException("Only axis-aligned grids can be resampled: " + grid);
        // Source array stride along each patient axis.
        int[] strides = {1, field.sizeX(), field.sizeX() * field.sizeY()};
        int pi = grid.patientAxis(0), pj = grid.patientAxis(1), pk = grid.patientAxis(2);
        final Bracket bx = bracket(pi, field.axis(pi), grid.axisCoordinates(0));
        final Bracket by = bracket(pj, field.axis(pj), grid.axisCoordinates(1));
        final Bracket bz = bracket(pk, field.axis(pk), grid.axisCoordinates(2));
        final int sx = strides[pi], sy = strides[pj], sz = strides[pk];

        final int nx = grid.sizeX(), ny = grid.sizeY(), nz = grid.sizeZ();
        final double[] src = field.values();
        final double[] out = new double[grid.voxelCount()];

        final AtomicInteger nextFrame = new AtomicInteger(0);
        Thread[] threads = ThreadUtil.createThreadArray(Math.min(options.getThreads(), nz));
        for (int t = 0; t < threads.length; t++) {
            threads[t] = new Thread(() -> {
                for (int k = nextFrame.getAndIncrement(); k < nz; k = nextFrame.getAndIncrement()) {
                    int z0 = bz.lo[k] * sz, z1 = bz.hi[k] * sz;
                    double wz = bz.weight[k];
                    for (int j = 0; j < ny; j++) {
                        int y0 = by.lo[j] * sy, y1 = by.hi[j] * sy;
                        double wy = by.weight[j];
                        int row = (k * ny + j) * nx;
                        for (int i = 0; i < nx; i++) {
                            int x0 = bx.lo[i] * sx, x1 = bx.hi[i] * sx;
                            double wx = bx.weight[i];
                            double c00 = lerp(src[z0 + y0 + x0], src[z0 + y0 + x1], wx);
                            double c10 = lerp(src[z0 + y1 + x0], src[z0 + y1 + x1], wx);
                            double c01 = lerp(src[z1 + y0 + x0], src[z1 + y0 + x1], wx);
                            double c11 = lerp(src[z1 + y1 + x0], src[z1 + y1 + x1], wx);
                            out[row + i] = lerp(lerp(c00, c10, wy), lerp(c01, c11, wy), wz);
                        }
                    }
                }
            }, "TrilinearResampler-" + t);
        }
        ThreadUtil.startAndJoin(threads);
        return new ResampledDoseVolume(grid.getSize(), out, field.getDoseUnits());
    }

    /**
     * Interpolate the field at a single point, with the same rules as {@link #resample}.
     */
    public double valueAt(ScalarField3D field, double x, double y, double z)
            throws MalformedGridException, ExtrapolationException {
        Bracket bx = bracket(0, field.axis(0), new double[] {x});
        Bracket by = bracket(1, field.axis(1), new double[] {y});
        Bracket bz = bracket(2, field.axis(2), new double[] {z});
        double c00 = lerp(field.getValue(bx.lo[0], by.lo[0], bz.lo[0]), field.getValue(bx.hi[0], by.lo[0], bz.lo[0]), bx.weight[0]);
        double c10 = lerp(field.getValue(bx.lo[0], by.hi[0], bz.lo[0]), field.getValue(bx.hi[0], by.hi[0], bz.lo[0]), bx.weight[0]);
        double c01 = lerp(field.getValue(bx.lo[0], by.lo[0], bz.hi[0]), field.getValue(bx.hi[0], by.lo[0], bz.hi[0]), bx.weight[0]);
        double c11 = lerp(field.getValue(bx.lo[0], by.hi[0], bz.hi[0]), field.getValue(bx.hi[0], by.hi[0], bz.hi[0]), bx.weight[0]);
        return lerp(lerp(c00, c10, by.weight[0]), lerp(c01, c11, by.weight[0]), bz.weight[0]);
    }

    // A weight of exactly 0 returns `a` unchanged, so lattice points are reproduced bit for bit.
    private static double lerp(double a, double b, double w) {
        return a * (1 - w) + b * w;
    }

    /**
     * Locate each target coordinate between two consecutive source coordinates.
     * @param axis      The patient axis, 0, 1 or 2, for messages.
     * @param source    Strictly increasing source coordinates.
     * @param targets   Target coordinates.
     */
    Bracket bracket(int axis, double[] source, double[] targets) throws MalformedGridException, ExtrapolationException {
        int n = source.length;
        if (n < 2)
            throw new MalformedGridException("The source " + AXIS_NAMES[axis] + " axis has " + n
                    + " coordinate(s); interpolation needs at least 2.");
        double eps = options.getToleranceEpsilon();
        Bracket b = new Bracket(targets.length);
        for (int t = 0; t < targets.length; t++) {
            double target = targets[t];
            if (target < source[0] - eps || target > source[n - 1] + eps) {
                if (options.getExtrapolation() == ResamplingOptions.Extrapolation.ERROR)
                    throw new ExtrapolationException("The reference voxel at " + AXIS_NAMES[axis] + " = " + target
                            + " mm lies outside the dose grid, which covers [" + source[0] + ", " + source[n - 1]
                            + "] mm on that axis.");
                b.snap(t, target < source[0] ? 0 : n - 1);
                continue;
            }
            int found = Arrays.binarySearch(source, target);
            if (found >= 0) {
                b.snap(t, found);
                continue;
            }
            int above = -found - 1;  // First coordinate greater than the target.
            if (above > 0 && target - source[above - 1] <= eps) {
                b.snap(t, above - 1);
            } else if (above < n && source[above] - target <= eps) {
                b.snap(t, above);
            } else {
                b.lo[t] = above - 1;
                b.hi[t] = above;
                b.weight[t] = (target - source[above - 1]) / (source[above] - source[above - 1]);
            }
        }
        return b;
    }

    /**
     * For each target coordinate, the indices of the source coordinates on either side and the
     * fractional position between them.
     */
    static class Bracket {
        final int[] lo;
        final int[] hi;
        final double[] weight;

        Bracket(int n) {
            lo = new int[n];
            hi = new int[n];
            weight = new double[n];
        }

        void snap(int t, int index) {
            lo[t] = index;
            hi[t] = index;
            weight[t] = 0;
        }
    }
}
