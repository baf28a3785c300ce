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
 * How the X, Y and Z columns of an Eyeplan table map onto the patient x, y and z axes of the dose grid.
 */
public enum AxisMapping {
    /** Eyeplan X, Y, Z are patient x, y, z. */
    IDENTITY("X Y Z", 0, 1, 2),
    /** Eyeplan X is left-right, Eyeplan Z runs along the rows and the Eyeplan Y planes become frames. */
    EYEPLAN("X Z Y", 0, 2, 1);

    private final String label;
    // For each patient axis, the index of the Eyeplan column it is read from.
    private final int[] sourceColumns;

    AxisMapping(String label, int... sourceColumns) {
        this.label = label;
        this.sourceColumns = sourceColumns;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @param point The Eyeplan row.
     * @return      The point's coordinates in patient axis order.
     */
    public double[] toPatient(DosePoint point) {
        double[] eyeplan = {point.x, point.y, point.z};
        return new double[] {
                eyeplan[sourceColumns[0]],
                eyeplan[sourceColumns[1]],
                eyeplan[sourceColumns[2]]
        };
    }

    public static String[] labels() {
        AxisMapping[] mappings = values();
        String[] labels = new String[mappings.length];
        for (int i = 0; i < mappings.length; i++)
            labels[i] = mappings[i].label;
        return labels;
    }

    public static AxisMapping fromLabel(String label) {
        for (AxisMapping mapping : values())
            if (mapping.label.equals(label) || mapping.name().equalsIgnoreCase(label)) return mapping;
        throw new IllegalArgumentException("Unknown axis mapping: '" + label + "'");
    }
}
