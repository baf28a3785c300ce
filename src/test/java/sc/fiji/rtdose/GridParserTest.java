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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GridParserTest {

    private static double[][][] cube(int nx, int ny, int nz) {
        double[][][] v = new double[nx][ny][nz];
        for (int i = 0; i < nx; i++)
            for (int j = 0; j < ny; j++)
                for (int k = 0; k < nz; k++)
                    v[i][j][k] = 100 * i + 10 * j + k;
        return v;
    }

    @Test
    void fromAxes_storesValuesWithXFastest() throws Exception {
        ScalarField3D field = GridParser.fromAxes(new double[] {0, 1, 2}, new double[] {0, 2}, new double[] {5, 6},
                cube(3, 2, 2), null);

        assertThat(field.sizeX()).isEqualTo(3);
        assertThat(field.getValue(2, 1, 0)).isEqualTo(210);
        assertThat(field.getValue(1, 0, 1)).isEqualTo(101);
        assertThat(field.getDoseUnits()).isEqualTo("GY");
        assertThat(field.maxValue()).isEqualTo(211);
    }

    @Test
    void fromAxes_reversesDescendingAxesTogetherWithTheValues() throws Exception {
        ScalarField3D field = GridParser.fromAxes(new double[] {2, 1, 0}, new double[] {0, 2}, new double[] {6, 5},
                cube(3, 2, 2), "RELATIVE");

        assertThat(field.getAxisX()).containsExactly(0, 1, 2);
        assertThat(field.getAxisZ()).containsExactly(5, 6);
        // Source index i=2 (x=0), k=1 (z=5) is now at i=0, k=0.
        assertThat(field.getValue(0, 1, 0)).isEqualTo(211);
        assertThat(field.getValue(2, 0, 1)).isEqualTo(0);
        assertThat(field.getDoseUnits()).isEqualTo("RELATIVE");
    }

    @Test
    void fromAxes_rejectsDegenerateAndNonMonotonicAxes() {
        assertThatThrownBy(() -> GridParser.fromAxes(new double[] {0}, new double[] {0, 1}, new double[] {0, 1},
                cube(1, 2, 2), null))
                .isInstanceOf(MalformedGridException.class)
                .hasMessageContaining("X axis");
        assertThatThrownBy(() -> GridParser.fromAxes(new double[] {0, 1}, new double[] {0, 1, 1}, new double[] {0, 1},
                cube(2, 3, 2), null))
                .isInstanceOf(MalformedGridException.class)
                .hasMessageContaining("more than once");
        assertThatThrownBy(() -> GridParser.fromAxes(new double[] {0, 2, 1}, new double[] {0, 1}, new double[] {0, 1},
                cube(3, 2, 2), null))
                .isInstanceOf(MalformedGridException.class)
                .hasMessageContaining("not monotonic");
    }

    @Test
    void fromAxes_rejectsShapeMismatchAndInvalidDoses() {
        assertThatThrownBy(() -> GridParser.fromAxes(new double[] {0, 1}, new double[] {0, 1}, new double[] {0, 1},
                cube(2, 2, 3), null))
                .isInstanceOf(MalformedGridException.class);

        double[][][] negative = cube(2, 2, 2);
        negative[1][1][1] = -0.5;
        assertThatThrownBy(() -> GridParser.fromAxes(new double[] {0, 1}, new double[] {0, 1}, new double[] {0, 1},
                negative, null))
                .isInstanceOf(MalformedGridException.class)
                .hasMessageContaining("-0.5");

        double[][][] nan = cube(2, 2, 2);
        nan[0][1][0] = Double.NaN;
        assertThatThrownBy(() -> GridParser.fromAxes(new double[] {0, 1}, new double[] {0, 1}, new double[] {0, 1},
                nan, null))
                .isInstanceOf(MalformedGridException.class);
    }

    @Test
    void fromTable_pivotsShuffledRowsWithTheEyeplanMapping() throws Exception {
        List<DosePoint> points = new ArrayList<>();
        for (double[] row : RtDoseFixtures.linearEyeplanRows())
            points.add(new DosePoint(row[0], row[1], row[2], row[3]));
        java.util.Collections.reverse(points);

        ScalarField3D field = GridParser.fromTable(new EyeplanDoseTable("N", "1", points), AxisMapping.EYEPLAN, "GY");

        assertThat(field.getAxisX()).containsExactly(0, 1, 2);
        for (int i = 0; i < 3; i++)
            for (int j = 0; j < 3; j++)
                for (int k = 0; k < 3; k++)
                    assertThat(field.getValue(i, j, k)).isEqualTo(RtDoseFixtures.linearDose(i, j, k));
    }

    @Test
    void fromTable_identityMappingKeepsColumnsInPlace() throws Exception {
        List<DosePoint> points = new ArrayList<>();
        for (int x = 0; x < 2; x++)
            for (int y = 0; y < 2; y++)
                for (int z = 0; z < 2; z++)
                    points.add(new DosePoint(x * 0.5, y, -z, x + 10 * y + 100 * z));

        ScalarField3D field = GridParser.fromTable(new EyeplanDoseTable(null, null, points), AxisMapping.IDENTITY, null);

        assertThat(field.getAxisX()).containsExactly(0, 0.5);
        assertThat(field.getAxisZ()).containsExactly(-1, 0);
        assertThat(field.getValue(1, 1, 0)).isEqualTo(111);
        assertThat(field.getValue(1, 0, 1)).isEqualTo(1);
    }

    @Test
    void fromTable_treatsNegativeZeroAsZero() throws Exception {
        List<DosePoint> points = new ArrayList<>();
        for (int x = 0; x < 2; x++)
            for (int y = 0; y < 2; y++)
                for (int z = 0; z < 2; z++)
                    points.add(new DosePoint(x == 0 && y == 1 ? -0.0 : x, y, z, 1));

        ScalarField3D field = GridParser.fromTable(new EyeplanDoseTable(null, null, points), AxisMapping.IDENTITY, null);

        assertThat(field.sizeX()).isEqualTo(2);
    }

    @Test
    void fromTable_rejectsDuplicateAndMissingPoints() {
        List<DosePoint> duplicate = new ArrayList<>(Arrays.asList(
                new DosePoint(0, 0, 0, 1), new DosePoint(1, 0, 0, 1), new DosePoint(0, 1, 0, 1), new DosePoint(1, 1, 0, 1),
                new DosePoint(0, 0, 1, 1), new DosePoint(1, 0, 1, 1), new DosePoint(0, 1, 1, 1), new DosePoint(0, 1, 1, 2)));
        assertThatThrownBy(() -> GridParser.fromTable(new EyeplanDoseTable(null, null, duplicate), AxisMapping.IDENTITY, null))
                .isInstanceOf(MalformedGridException.class)
                .hasMessageContaining("more than once");

        List<DosePoint> missing = new ArrayList<>(duplicate.subList(0, 7));
        assertThatThrownBy(() -> GridParser.fromTable(new EyeplanDoseTable(null, null, missing), AxisMapping.IDENTITY, null))
                .isInstanceOf(MalformedGridException.class)
                .hasMessageContaining("no value at (1.0, 1.0, 1.0)");
    }

    @Test
    void fromTable_rejectsEmptyTablesAndFlatAxes() {
        assertThatThrownBy(() -> GridParser.fromTable(new EyeplanDoseTable(null, null, new ArrayList<>()),
                AxisMapping.IDENTITY, null))
                .isInstanceOf(MalformedGridException.class);

        List<DosePoint> flat = Arrays.asList(
                new DosePoint(0, 0, 0, 1), new DosePoint(1, 0, 0, 1), new DosePoint(0, 1, 0, 1), new DosePoint(1, 1, 0, 1));
        assertThatThrownBy(() -> GridParser.fromTable(new EyeplanDoseTable(null, null, flat), AxisMapping.IDENTITY, null))
                .isInstanceOf(MalformedGridException.class)
                .hasMessageContaining("Z axis");
    }

    @Test
    void axisMapping_parsesLabelsAndNames() {
        assertThat(AxisMapping.fromLabel("X Z Y")).isEqualTo(AxisMapping.EYEPLAN);
        assertThat(AxisMapping.fromLabel("identity")).isEqualTo(AxisMapping.IDENTITY);
        assertThat(AxisMapping.EYEPLAN.toPatient(new DosePoint(1, 2, 3, 0))).containsExactly(1, 3, 2);
        assertThatThrownBy(() -> AxisMapping.fromLabel("Y X Z")).isInstanceOf(IllegalArgumentException.class);
    }
}
