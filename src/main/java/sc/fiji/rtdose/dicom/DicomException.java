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

import ij.IJ;

/**
 * Raised when a DICOM file cannot be decoded, or a dataset cannot be encoded.
 */
public class DicomException extends Exception {
    // The byte offset into the file at which the problem was found, or -1.
    private final long offset;

    public DicomException(String message) {
        this(message, -1);
    }

    public DicomException(String message, long offset) {
        super(message);
        this.offset = offset;
    }

    public long getOffset() {
        return offset;
    }

    @Override
    public String getMessage() {
        if (offset < 0) return super.getMessage();
        return super.getMessage() + " (at byte " + offset + ")";
    }

    public void report() {
        IJ.error("DICOM", getMessage());
    }
}
