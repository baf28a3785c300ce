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

import sc.fiji.rtdose.dicom.DicomDataset;
import sc.fiji.rtdose.dicom.DicomTags;

import java.util.Arrays;

/**
 * Extracts the voxel lattice of a reference RT Dose object.
 *
 * Pixel Spacing lists the row spacing (between rows, along the column direction) before the column
 * spacing (along the row direction). Row and column directions may be any standard basis vectors or
 * their negations, so each grid axis runs along one patient axis.
 * Frames are spaced by the step of Grid Frame Offset Vector, which may hold offsets relative to the
 * first frame or absolute positions along the normal; only the differences between entries are used.
 */
public final class ReferenceGeometryReader {
    // Direction cosines are accepted as axis aligned when every component is within this of 0, 1 or -1.
    public static final double ORIENTATION_TOLERANCE = 1e-6;
    // Relative tolerance on the frame step, to absorb the rounding of decimal strings.
    public static final double FRAME_STEP_TOLERANCE = 1e-4;

    private ReferenceGeometryReader() {
    }

    public static VoxelGrid read(DicomDataset reference)
            throws MissingGeometryException, UnsupportedOrientationException {
        try {
            return readGrid(reference);
        } catch (NumberFormatException e) {
            throw new MissingGeometryException("The reference dose has a malformed geometric attribute: "
                    + e.getMessage(), e);
        }
    }

    private static VoxelGrid readGrid(DicomDataset reference)
            throws MissingGeometryException, UnsupportedOrientationException {
        double[] position = require(reference, DicomTags.IMAGE_POSITION_PATIENT, "Image Position (Patient)", 3);
        double[] orientation = require(reference, DicomTags.IMAGE_ORIENTATION_PATIENT, "Image Orientation (Patient)", 6);
        double[] pixelSpacing = require(reference, DicomTags.PIXEL_SPACING, "Pixel Spacing", 2);

        double[] rowDirection = basisVector(Arrays.copyOfRange(orientation, 0, 3));
        double[] columnDirection = basisVector(Arrays.copyOfRange(orientation, 3, 6));
        if (rowDirection == null || columnDirection == null || axisOf(rowDirection) == axisOf(columnDirection))
            throw new UnsupportedOrientationException("Only axis-aligned dose grids can be resampled, but"
                    + " Image Orientation (Patient) is " + Arrays.toString(orientation) + ".");

        int columns = reference.getInt(DicomTags.COLUMNS, 0);
        int rows = reference.getInt(DicomTags.ROWS, 0);
        int frames = reference.getInt(DicomTags.NUMBER_OF_FRAMES, 1);
        if (columns <= 0) throw new MissingGeometryException("The reference dose has no positive Columns value.");
        if (rows <= 0) throw new MissingGeometryException("The reference dose has no positive Rows value.");
        if (frames <= 0) throw new MissingGeometryException("Number of Frames must be positive, found " + frames + ".");
        long voxels = (long) columns * rows * frames;
        if (voxels > VoxelGrid.MAX_VOXELS)
            throw new MissingGeometryException("The reference dose grid " + columns + "x" + rows + "x" + frames
                    + " is too large: it has " + voxels + " voxels, at most " + VoxelGrid.MAX_VOXELS + " are supported.");

        double spacingX = pixelSpacing[1];
        double spacingY = pixelSpacing[0];
        if (!(spacingX > 0) || !(spacingY > 0))
            throw new MissingGeometryException("Pixel Spacing must be positive, found "
                    + Arrays.toString(pixelSpacing) + ".");
        double spacingZ = frames > 1 ? frameStep(reference, frames) : nominalThickness(reference);

        return new VoxelGrid(position, new double[] {spacingX, spacingY, spacingZ},
                new int[] {columns, rows, frames},
                new double[][] {rowDirection, columnDirection, cross(rowDirection, columnDirection)});
    }

    /**
     * @return  The signed standard basis vector `v` is within tolerance of, or null.
     */
    static double[] basisVector(double[] v) {
        double[] unit = new double[3];
        int found = -1;
        for (int d = 0; d < 3; d++) {
            if (Math.abs(v[d]) <= ORIENTATION_TOLERANCE) continue;
            if (found >= 0 || !(Math.abs(Math.abs(v[d]) - 1) <= ORIENTATION_TOLERANCE)) return null;
            found = d;
            unit[d] = Math.signum(v[d]);
        }
        return found < 0 ? null : unit;
    }

    private static int axisOf(double[] unit) {
        return unit[0] != 0 ? 0 : unit[1] != 0 ? 1 : 2;
    }

    // Frames advance along the normal of the image plane.
    private static double[] cross(double[] a, double[] b) {
        return new double[] {
                a[1] * b[2] - a[2] * b[1],
                a[2] * b[0] - a[0] * b[2],
                a[0] * b[1] - a[1] * b[0]};
    }

    private static double[] require(DicomDataset reference, int tag, String name, int count)
            throws MissingGeometryException {
        double[] values = reference.getDoubles(tag);
        if (values == null)
            throw new MissingGeometryException("The reference dose has no " + name + ".");
        if (values.length != count)
            throw new MissingGeometryException(name + " must have " + count + " values, found " + values.length + ".");
        for (double v : values)
            if (!Double.isFinite(v))
                throw new MissingGeometryException(name + " must contain finite values.");
        return values;
    }

    private static double frameStep(DicomDataset reference, int frames) throws MissingGeometryException {
        double[] offsets = reference.getDoubles(DicomTags.GRID_FRAME_OFFSET_VECTOR);
        if (offsets == null)
            throw new MissingGeometryException("The reference dose has " + frames
                    + " frames but no Grid Frame Offset Vector.");
        if (offsets.length != frames)
            throw new MissingGeometryException("Grid Frame Offset Vector has " + offsets.length
                    + " entries but Number of Frames is " + frames + ".");
        double step = offsets[1] - offsets[0];
        if (!(step > 0) || !Double.isFinite(step))
            throw new MissingGeometryException("Grid Frame Offset Vector must be strictly increasing, found "
                    + offsets[0] + " then " + offsets[1] + ".");
        for (int k = 2; k < frames; k++) {
            double d = offsets[k] - offsets[k - 1];
            if (!(Math.abs(d - step) <= FRAME_STEP_TOLERANCE * step))
                throw new MissingGeometryException("Grid Frame Offset Vector is not uniformly spaced at frame " + k
                        + ": step " + d + " instead of " + step + ".");
        }
        return step;
    }

    private static double nominalThickness(DicomDataset reference) {
        double[] thickness = reference.getDoubles(DicomTags.SLICE_THICKNESS);
        if (thickness != null && thickness.length > 0 && thickness[0] > 0 && Double.isFinite(thickness[0]))
            return thickness[0];
        return 1.0;
    }
}
