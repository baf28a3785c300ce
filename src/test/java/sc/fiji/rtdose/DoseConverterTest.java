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
import sc.fiji.rtdose.dicom.DicomDataset;
import sc.fiji.rtdose.dicom.DicomTags;
import sc.fiji.rtdose.dicom.VR;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DoseConverterTest {
    private static final ConversionOptions OPTIONS = new ConversionOptions(
            new ResamplingOptions(ResamplingOptions.Extrapolation.CLAMP, ResamplingOptions.DEFAULT_TOLERANCE, 2),
            EncodingOptions.defaults(), AxisMapping.EYEPLAN, "GY");

    private static ScalarField3D eyeplanField() throws MalformedGridException {
        List<DosePoint> points = new ArrayList<>();
        for (double[] row : RtDoseFixtures.linearEyeplanRows())
            points.add(new DosePoint(row[0], row[1], row[2], row[3]));
        return GridParser.fromTable(new EyeplanDoseTable("EYE^PATIENT", "E-42", points), AxisMapping.EYEPLAN, "GY");
    }

    private static DicomDataset reference() {
        return RtDoseFixtures.reference(new double[] {0.5, 0.5, 0.5}, new double[] {0.5, 0.5, 0.5}, new int[] {3, 2, 2});
    }

    @Test
    void convert_resamplesOntoTheReferenceGrid() throws Exception {
        DicomDataset reference = reference();
        VoxelGrid grid = ReferenceGeometryReader.read(reference);

        ConversionResult result = new DoseConverter(OPTIONS).convert(eyeplanField(), grid, reference);

        assertThat(result.getGrid()).isSameAs(grid);
        ResampledDoseVolume dose = result.getResampled();
        assertThat(dose.getSize()).containsExactly(3, 2, 2);
        for (int k = 0; k < 2; k++)
            for (int j = 0; j < 2; j++)
                for (int i = 0; i < 3; i++) {
                    double[] p = grid.position(i, j, k);
                    double expected = RtDoseFixtures.linearDose(p[0], p[1], p[2]);
                    assertThat(dose.get(i, j, k)).isCloseTo(expected, within(1e-9));
                    int index = (k * 2 + j) * 3 + i;
                    assertThat(result.getEncoded().decode(index))
                            .isCloseTo(expected, within(result.getEncoded().getScaleFactor()));
                }
    }

    @Test
    void convert_allocatesNewUidsOnEveryRun() throws Exception {
        DicomDataset reference = reference();
        VoxelGrid grid = ReferenceGeometryReader.read(reference);
        DoseConverter converter = new DoseConverter(OPTIONS);

        OutputIdentity first = converter.convert(eyeplanField(), grid, reference).getIdentity();
        OutputIdentity second = converter.convert(eyeplanField(), grid, reference).getIdentity();

        assertThat(first.all()).doesNotContainAnyElementsOf(second.all());
        assertThat(first.all()).doesNotContainAnyElementsOf(DoseConverter.referenceUids(reference));
    }

    @Test
    void convert_rejectsRotatedGrids() throws Exception {
        VoxelGrid rotated = new VoxelGrid(new double[] {0, 0, 0}, new double[] {1, 1, 1}, new int[] {2, 2, 2},
                new double[][] {{0.6, 0.8, 0}, {-0.8, 0.6, 0}, VoxelGrid.UNIT_Z});
        VoxelGrid folded = new VoxelGrid(new double[] {0, 0, 0}, new double[] {1, 1, 1}, new int[] {2, 2, 2},
                new double[][] {VoxelGrid.UNIT_X, VoxelGrid.UNIT_X, VoxelGrid.UNIT_Z});
        ScalarField3D field = eyeplanField();

        assertThatThrownBy(() -> new DoseConverter(OPTIONS).convert(field, rotated, reference()))
                .isInstanceOf(UnsupportedOrientationException.class);
        assertThatThrownBy(() -> new DoseConverter(OPTIONS).convert(field, folded, reference()))
                .isInstanceOf(UnsupportedOrientationException.class);
    }

    @Test
    void convert_resamplesOntoSwappedAxesAndKeepsTheirOrientation() throws Exception {
        DicomDataset reference = reference();
        reference.putDecimals(DicomTags.IMAGE_ORIENTATION_PATIENT, 0, 1, 0, 1, 0, 0);
        VoxelGrid grid = ReferenceGeometryReader.read(reference);
        DoseConverter converter = new DoseConverter(OPTIONS);

        ConversionResult result = converter.convert(eyeplanField(), grid, reference);
        DicomDataset out = converter.assemble(reference, grid, result, null, null);

        ResampledDoseVolume dose = result.getResampled();
        for (int k = 0; k < 2; k++)
            for (int j = 0; j < 2; j++)
                for (int i = 0; i < 3; i++) {
                    double[] p = grid.position(i, j, k);
                    assertThat(dose.get(i, j, k)).isCloseTo(RtDoseFixtures.linearDose(p[0], p[1], p[2]), within(1e-9));
                }
        assertThat(out.getDoubles(DicomTags.IMAGE_ORIENTATION_PATIENT)).containsExactly(0, 1, 0, 1, 0, 0);
        assertThat(ReferenceGeometryReader.read(out).axisCoordinates(2)).containsExactly(0.5, 0);
    }

    @Test
    void assemble_buildsAnRtDoseOnTheReferenceFrame() throws Exception {
        DicomDataset reference = reference();
        VoxelGrid grid = ReferenceGeometryReader.read(reference);
        DoseConverter converter = new DoseConverter(OPTIONS);
        ConversionResult result = converter.convert(eyeplanField(), grid, reference);

        DicomDataset out = converter.assemble(reference, grid, result, "EYE^PATIENT", "E-42");

        assertThat(out.getString(DicomTags.SOP_CLASS_UID)).isEqualTo(DoseMetadataReconciler.RT_DOSE_STORAGE);
        assertThat(out.getString(DicomTags.MODALITY)).isEqualTo("RTDOSE");
        assertThat(out.getString(DicomTags.SOP_INSTANCE_UID)).isEqualTo(result.getIdentity().getSopInstanceUid());
        assertThat(out.getString(DicomTags.STUDY_INSTANCE_UID)).isEqualTo(result.getIdentity().getStudyInstanceUid());
        assertThat(out.getString(DicomTags.SERIES_INSTANCE_UID)).isEqualTo(result.getIdentity().getSeriesInstanceUid());
        assertThat(out.getString(DicomTags.FRAME_OF_REFERENCE_UID)).isEqualTo(RtDoseFixtures.REFERENCE_FRAME_OF_REFERENCE);
        assertThat(out.getString(DicomTags.PATIENT_NAME)).isEqualTo("EYE^PATIENT");
        assertThat(out.getString(DicomTags.PATIENT_ID)).isEqualTo("E-42");
        assertThat(out.contains(DicomTags.DVH_SEQUENCE)).isFalse();

        assertThat(out.getDoubles(DicomTags.IMAGE_POSITION_PATIENT)).containsExactly(0.5, 0.5, 0.5);
        assertThat(out.getDoubles(DicomTags.IMAGE_ORIENTATION_PATIENT)).containsExactly(1, 0, 0, 0, 1, 0);
        assertThat(out.getDoubles(DicomTags.PIXEL_SPACING)).containsExactly(0.5, 0.5);
        assertThat(out.getDoubles(DicomTags.GRID_FRAME_OFFSET_VECTOR)).containsExactly(0, 0.5);
        assertThat(out.getInt(DicomTags.COLUMNS, 0)).isEqualTo(3);
        assertThat(out.getInt(DicomTags.ROWS, 0)).isEqualTo(2);
        assertThat(out.getInt(DicomTags.NUMBER_OF_FRAMES, 0)).isEqualTo(2);
        assertThat(out.getInt(DicomTags.BITS_ALLOCATED, 0)).isEqualTo(32);
        assertThat(out.getInt(DicomTags.HIGH_BIT, 0)).isEqualTo(31);
        assertThat(out.getInt(DicomTags.PIXEL_REPRESENTATION, -1)).isZero();
        assertThat(out.getString(DicomTags.DOSE_UNITS)).isEqualTo("GY");
        assertThat(out.getString(DicomTags.DOSE_TYPE)).isEqualTo("PHYSICAL");
        assertThat(out.getString(DicomTags.DOSE_SUMMATION_TYPE)).isEqualTo("PLAN");
        assertThat(out.getDoubles(DicomTags.DOSE_GRID_SCALING)[0]).isEqualTo(result.getEncoded().getScaleFactor());

        byte[] pixels = out.get(DicomTags.PIXEL_DATA).getValue();
        assertThat(pixels).hasSize(3 * 2 * 2 * 4);
        long last = Integer.toUnsignedLong(ByteBuffer.wrap(pixels).order(ByteOrder.LITTLE_ENDIAN).getInt(44));
        assertThat(last).isEqualTo(result.getEncoded().getRaw(2, 1, 1));

        // The reference is left untouched.
        assertThat(reference.contains(DicomTags.DVH_SEQUENCE)).isTrue();
        assertThat(reference.getString(DicomTags.PATIENT_ID)).isEqualTo("REF-001");
    }

    @Test
    void assemble_keepsReferencePatientWhenTheWorkbookHasNone() throws Exception {
        DicomDataset reference = reference();
        VoxelGrid grid = ReferenceGeometryReader.read(reference);
        DoseConverter converter = new DoseConverter(OPTIONS);
        ConversionResult result = converter.convert(eyeplanField(), grid, reference);

        DicomDataset out = converter.assemble(reference, grid, result, null, null);

        assertThat(out.getString(DicomTags.PATIENT_NAME)).isEqualTo("REFERENCE^PATIENT");
        assertThat(out.getString(DicomTags.PATIENT_ID)).isEqualTo("REF-001");
    }

    @Test
    void assemble_switchesToUtf8ForNonAsciiNames() throws Exception {
        DicomDataset reference = reference();
        VoxelGrid grid = ReferenceGeometryReader.read(reference);
        DoseConverter converter = new DoseConverter(OPTIONS);
        ConversionResult result = converter.convert(eyeplanField(), grid, reference);

        DicomDataset out = converter.assemble(reference, grid, result, "Müller^Zoë", "E-42");

        assertThat(out.charset()).isEqualTo(StandardCharsets.UTF_8);
        assertThat(out.getString(DicomTags.PATIENT_NAME)).isEqualTo("Müller^Zoë");
    }

    @Test
    void assemble_reencodesLatin1TextWhenSwitchingToUtf8() throws Exception {
        DicomDataset reference = reference();
        reference.putString(DicomTags.SPECIFIC_CHARACTER_SET, VR.CS, "ISO_IR 100");
        reference.putString(DicomTags.DOSE_COMMENT, VR.LO, "Dosé à l'oeil");
        VoxelGrid grid = ReferenceGeometryReader.read(reference);
        DoseConverter converter = new DoseConverter(OPTIONS);
        ConversionResult result = converter.convert(eyeplanField(), grid, reference);

        DicomDataset out = converter.assemble(reference, grid, result, "Müller^Zoë", "E-42");

        assertThat(out.getString(DicomTags.SPECIFIC_CHARACTER_SET)).isEqualTo("ISO_IR 192");
        assertThat(out.getString(DicomTags.DOSE_COMMENT)).isEqualTo("Dosé à l'oeil");
        assertThat(new String(out.get(DicomTags.DOSE_COMMENT).getValue(), StandardCharsets.UTF_8).trim())
                .isEqualTo("Dosé à l'oeil");
        assertThat(out.getString(DicomTags.PATIENT_NAME)).isEqualTo("Müller^Zoë");
        assertThat(reference.getString(DicomTags.DOSE_COMMENT)).isEqualTo("Dosé à l'oeil");
    }

    @Test
    void assemble_needsAFrameOfReference() throws Exception {
        DicomDataset reference = reference();
        VoxelGrid grid = ReferenceGeometryReader.read(reference);
        DoseConverter converter = new DoseConverter(OPTIONS);
        ConversionResult result = converter.convert(eyeplanField(), grid, reference);
        reference.remove(DicomTags.FRAME_OF_REFERENCE_UID);

        assertThatThrownBy(() -> converter.assemble(reference, grid, result, null, null))
                .isInstanceOf(MissingGeometryException.class)
                .hasMessageContaining("Frame of Reference");
    }

    @Test
    void convert_failsWhenNoFreshUidCanBeFound() throws Exception {
        DicomDataset reference = reference();
        VoxelGrid grid = ReferenceGeometryReader.read(reference);
        IdentityGenerator identities = new IdentityGenerator(
                Collections.nCopies(3, RtDoseFixtures.REFERENCE_SOP_INSTANCE).iterator()::next);
        DoseConverter converter = new DoseConverter(new TrilinearResampler(OPTIONS.getResampling()),
                new DoseEncoder(OPTIONS.getEncoding()), identities);

        assertThatThrownBy(() -> converter.convert(eyeplanField(), grid, reference))
                .isInstanceOf(IdentityGenerationException.class);
    }
}
