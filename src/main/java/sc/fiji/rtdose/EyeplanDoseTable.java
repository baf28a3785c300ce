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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The contents of an Eyeplan dose workbook: the patient identification found above the table,
 * and the dose rows in the order they were listed.
 */
public class EyeplanDoseTable {
    private final String patientName;
    private final String patientId;
    private final List<DosePoint> points;

    public EyeplanDoseTable(String patientName, String patientId, List<DosePoint> points) {
        this.patientName = patientName;
        this.patientId = patientId;
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
    }

    /**
     * @return  The patient name from cell A1, or null when the cell is empty.
     */
    public String getPatientName() {
        return patientName;
    }

    /**
     * @return  The patient ID from cell A2, or null when the cell is empty.
     */
    public String getPatientId() {
        return patientId;
    }

    public List<DosePoint> getPoints() {
        return points;
    }

    public String toString() {
        return "EyeplanDoseTable(patientName=" + patientName
                + ", patientId=" + patientId
                + ", points=" + points.size()
                + ")";
    }
}
