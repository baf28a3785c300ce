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
 * One row of an Eyeplan dose table: a position in Eyeplan coordinates (millimetres) and the dose there.
 */
public class DosePoint {
    public final double x;
    public final double y;
    public final double z;
    public final double dose;

    public DosePoint(double x, double y, double z, double dose) {
        this.x = x;
        this.y = y;
        this.z = z;
        this.dose = dose;
    }

    public String toString() {
        return "DosePoint(" + x + ", " + y + ", " + z + ": " + dose + ")";
    }
}
