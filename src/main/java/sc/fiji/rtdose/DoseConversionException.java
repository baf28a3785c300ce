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

import ij.IJ;

/**
 * Base class of the failures raised while turning an Eyeplan dose table into an RT Dose object.
 * The conversion itself never reports anything; callers decide whether to {@link #report()} or rethrow.
 * @author Andre Faubert 2024-04
 */
public class DoseConversionException extends Exception {
    public static final String TITLE = "Eyeplan to DICOM RT Dose";

    public DoseConversionException(String message) {
        super(message);
    }

    public DoseConversionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Show the message in an error dialog, or print it when ImageJ runs headless.
     */
    public void report() {
        IJ.error(TITLE, getMessage());
    }
}
