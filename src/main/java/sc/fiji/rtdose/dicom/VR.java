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
package sc.fiji.rtdose.dicom;

/**
 * DICOM value representations, with what is needed to encode them in explicit VR little endian.
 */
public enum VR {
    AE(false, ' ', true),
    AS(false, ' ', true),
    AT(false, 0, false),
    CS(false, ' ', true),
    DA(false, ' ', true),
    DS(false, ' ', true),
    DT(false, ' ', true),
    FD(false, 0, false),
    FL(false, 0, false),
    IS(false, ' ', true),
    LO(false, ' ', true),
    LT(false, ' ', true),
    OB(true, 0, false),
    OD(true, 0, false),
    OF(true, 0, false),
    OL(true, 0, false),
    OV(true, 0, false),
    OW(true, 0, false),
    PN(false, ' ', true),
    SH(false, ' ', true),
    SL(false, 0, false),
    SQ(true, 0, false),
    SS(false, 0, false),
    ST(false, ' ', true),
    SV(true, 0, false),
    TM(false, ' ', true),
    UC(true, ' ', true),
    UI(false, 0, true),
    UL(false, 0, false),
    UN(true, 0, false),
    UR(true, ' ', true),
    US(false, 0, false),
    UT(true, ' ', true),
    UV(true, 0, false);

    // True when explicit VR encoding uses two reserved bytes and a 32-bit length.
    public final boolean longLength;
    // The byte appended to values of odd length.
    public final byte padding;
    public final boolean text;

    VR(boolean longLength, int padding, boolean text) {
        this.longLength = longLength;
        this.padding = (byte) padding;
        this.text = text;
    }

    /**
     * @return  The VR spelled by two ASCII bytes, or null when they do not spell one.
     */
    public static VR of(byte first, byte second) {
        if (first < 'A' || first > 'Z' || second < 'A' || second > 'Z') return null;
        try {
            return valueOf(new String(new char[] {(char) first, (char) second}));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
