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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * Unsigned integer doses and the Dose Grid Scaling that turns them back into physical doses:
 * dose = raw * scale. Values are stored in int arrays and read as unsigned, so 32-bit pixels keep their full range.
 */
public class EncodedDoseVolume {
    private final int[] size;
    private final int[] raw;
    private final PixelWidth pixelWidth;
    private final double scaleFactor;
    private final String doseUnits;

    EncodedDoseVolume(int[] size, int[] raw, PixelWidth pixelWidth, double scaleFactor, String doseUnits) {
        this.size = size.clone();
        this.raw = raw;
        this.pixelWidth = pixelWidth;
        this.scaleFactor = scaleFactor;
        this.doseUnits = doseUnits;
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
        return raw.length;
    }

    public PixelWidth getPixelWidth() {
        return pixelWidth;
    }

    public double getScaleFactor() {
        return scaleFactor;
    }

    public String getDoseUnits() {
        return doseUnits;
    }

    public long getRaw(int index) {
        return Integer.toUnsignedLong(raw[index]);
    }

    public long getRaw(int i, int j, int k) {
        return getRaw((k * size[1] + j) * size[0] + i);
    }

    public double decode(int index) {
        return getRaw(index) * scaleFactor;
    }

    public long maxRaw() {
        long max = 0;
        for (int r : raw)
            max = Math.max(max, Integer.toUnsignedLong(r));
        return max;
    }

    /**
     * @return  The pixel data in little-endian order, 2 or 4 bytes per voxel.
     */
    public byte[] toPixelData() {
        ByteBuffer buf = ByteBuffer.allocate(Math.multiplyExact(raw.length, pixelWidth.bytesPerPixel())).order(ByteOrder.LITTLE_ENDIAN);
        if (pixelWidth == PixelWidth.UINT16) {
            for (int r : raw)
                buf.putShort((short) r);
        } else {
            for (int r : raw)
                buf.putInt(r);
        }
        return buf.array();
    }

    public String toString() {
        return "EncodedDoseVolume(size=" + Arrays.toString(size)
                + ", pixelWidth=" + pixelWidth
                + ", scaleFactor=" + scaleFactor
                + ", maxRaw=" + maxRaw()
                + ")";
    }
}
