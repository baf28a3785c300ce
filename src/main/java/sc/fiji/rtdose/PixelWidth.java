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
 * The unsigned integer types an RT Dose pixel may be stored as.
 */
public enum PixelWidth {
    UINT16(16),
    UINT32(32);

    public final int bits;

    PixelWidth(int bits) {
        this.bits = bits;
    }

    /**
     * @return  2^bits - 1.
     */
    public long maxValue() {
        return (1L << bits) - 1;
    }

    public int bytesPerPixel() {
        return bits / 8;
    }

    public static PixelWidth fromBits(int bits) {
        for (PixelWidth width : values())
            if (width.bits == bits) return width;
        throw new IllegalArgumentException("Unsupported pixel width: " + bits + " bits. Use 16 or 32.");
    }
}
