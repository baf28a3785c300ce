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

import sc.fiji.rtdose.dicom.DicomDataset;
import sc.fiji.rtdose.dicom.DicomTags;

import java.util.Arrays;
import java.util.List;

/**
 * Converts a source dose field into an RT Dose object on the grid of a reference dose.
 * Nothing here performs I/O or logs; every failure is thrown to the caller.
 * @author Andre Faubert 2024-04
 */
public class DoseConverter {
    private final TrilinearResampler resampler;
    private final DoseEncoder encoder;
    private final IdentityGenerator identities;

    public DoseConverter(ConversionOptions options) {
        this(new TrilinearResampler(options.getResampling()), new DoseEncoder(options.getEncoding()),
                new IdentityGenerator());
    }

    public DoseConverter(TrilinearResampler resampler, DoseEncoder encoder, IdentityGenerator identities) {
        this.resampler = resampler;
        this.encoder = encoder;
        this.identities = identities;
    }

    /**
     * Resample, encode, and allocate new UIDs.
     * @param sourceField       The dose to convert.
     * @param referenceGrid     The grid to resample onto.
     * @param referenceMetadata The reference object, whose UIDs the new ones must differ from.
     */
    public ConversionResult convert(ScalarField3D sourceField, VoxelGrid referenceGrid, DicomDataset referenceMetadata)
            throws DoseConversionException {
        checkAxisAligned(referenceGrid);
        ResampledDoseVolume resampled = resampler.resample(sourceField, referenceGrid);
        EncodedDoseVolume encoded = encoder.encode(resampled);
        OutputIdentity identity = identities.generate(referenceUids(referenceMetadata));
        return new ConversionResult(resampled, encoded, identity, referenceGrid);
    }

    /**
     * Build the dataset to write for a conversion result.
     * @see DoseMetadataReconciler#assemble
     */
    public DicomDataset assemble(DicomDataset referenceMetadata, VoxelGrid referenceGrid, ConversionResult result,
                                 String patientName, String patientId) throws MissingGeometryException {
        return DoseMetadataReconciler.assemble(referenceMetadata, referenceGrid, result.getEncoded(),
                result.getIdentity(), patientName, patientId);
    }

    static List<String> referenceUids(DicomDataset reference) {
        return Arrays.asList(
                reference.getString(DicomTags.SOP_INSTANCE_UID),
                reference.getString(DicomTags.STUDY_INSTANCE_UID),
                reference.getString(DicomTags.SERIES_INSTANCE_UID),
                reference.getString(DicomTags.FRAME_OF_REFERENCE_UID));
    }

    private static void checkAxisAligned(VoxelGrid grid) throws UnsupportedOrientationException {
        for (int a = 0; a < 3; a++)
            if (grid.patientAxis(a) < 0)
                throw new UnsupportedOrientationException("Only axis-aligned grids can be resampled, but axis "
                        + a + " points along " + Arrays.toString(grid.getDirection(a)) + ".");
        if (!grid.isAxisAligned())
            throw new UnsupportedOrientationException("Only axis-aligned grids can be resampled, but two axes of "
                    + grid + " run along the same patient axis.");
    }
}
