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

import ij.ImagePlus;
import ij.ImageStack;
import ij.measure.Calibration;
import ij.process.FloatProcessor;

/**
 * Builds calibrated ImageJ images of resampled doses, for inspection after a conversion.
 */
public final class DoseImages {
    private DoseImages() {
    }

    /**
     * @param title     The image title.
     * @param volume    The doses, one slice per frame.
     * @param grid      The grid the doses were resampled onto; it sets the spatial calibration.
     * @return          A 32-bit stack whose pixel values are doses in the volume's unit.
     */
    public static ImagePlus toImagePlus(String title, ResampledDoseVolume volume, VoxelGrid grid) {
        int nx = volume.sizeX(), ny = volume.sizeY(), nz = volume.sizeZ();
        ImageStack stack = new ImageStack(nx, ny);
        for (int k = 0; k < nz; k++)
            stack.addSlice("z=" + (float) grid.position(0, 0, k)[2], new FloatProcessor(nx, ny, volume.frame(k)));

        ImagePlus imp = new ImagePlus(title, stack);
        imp.setCalibration(calibration(grid, volume.getDoseUnits()));
        imp.getProcessor().setMinAndMax(0, Math.max(volume.max(), Float.MIN_VALUE));
        return imp;
    }

    static Calibration calibration(VoxelGrid grid, String doseUnits) {
        double[] spacing = grid.getSpacing();
        double[] origin = grid.getOrigin();
        Calibration cal = new Calibration();
        cal.setUnit("mm");
        cal.pixelWidth = spacing[0];
        cal.pixelHeight = spacing[1];
        cal.pixelDepth = spacing[2];
        // ImageJ origins are in pixels, measured from the first voxel to the coordinate origin.
        cal.xOrigin = -origin[0] / spacing[0];
        cal.yOrigin = -origin[1] / spacing[1];
        cal.zOrigin = -origin[2] / spacing[2];
        cal.setValueUnit(doseUnits);
        return cal;
    }
}
