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

import java.util.Arrays;
import java.util.List;

/**
 * The unique identifiers given to a converted dose object. They are generated once per conversion.
 */
public class OutputIdentity {
    private final String studyInstanceUid;
    private final String seriesInstanceUid;
    private final String sopInstanceUid;

    public OutputIdentity(String studyInstanceUid, String seriesInstanceUid, String sopInstanceUid) {
        this.studyInstanceUid = studyInstanceUid;
        this.seriesInstanceUid = seriesInstanceUid;
        this.sopInstanceUid = sopInstanceUid;
    }

    public String getStudyInstanceUid() {
        return studyInstanceUid;
    }

    public String getSeriesInstanceUid() {
        return seriesInstanceUid;
    }

    public String getSopInstanceUid() {
        return sopInstanceUid;
    }

    public List<String> all() {
        return Arrays.asList(studyInstanceUid, seriesInstanceUid, sopInstanceUid);
    }

    public String toString() {
        return "OutputIdentity(study=" + studyInstanceUid
                + ", series=" + seriesInstanceUid
                + ", sopInstance=" + sopInstanceUid
                + ")";
    }
}
