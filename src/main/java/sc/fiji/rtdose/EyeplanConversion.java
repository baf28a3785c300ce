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
import sc.fiji.rtdose.dicom.DicomDataset;
import sc.fiji.rtdose.dicom.DicomException;
import sc.fiji.rtdose.dicom.DicomFileReader;
import sc.fiji.rtdose.dicom.DicomFileWriter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The file-to-file conversion shared by the plugin and the command line: read an Eyeplan workbook and a
 * reference RT Dose file, and write the Eyeplan dose on the reference's grid as a new RT Dose file.
 * @author Andre Faubert 2024-04
 */
public class EyeplanConversion {
    private final ConversionOptions options;
    private final DoseConverter converter;

    public EyeplanConversion(ConversionOptions options) {
        this(options, new DoseConverter(options));
    }

    EyeplanConversion(ConversionOptions options, DoseConverter converter) {
        this.options = options;
        this.converter = converter;
    }

    public ConversionOptions getOptions() {
        return options;
    }

    /**
     * @param workbook      The Eyeplan export (.xlsx or .xls).
     * @param reference     The RT Dose file whose grid and Frame of Reference the output adopts.
     * @param output        Where to write the new RT Dose file. An existing file is replaced.
     * @return              The resampled and encoded dose that was written.
     * @throws IOException  When a file cannot be read or written.
     */
    public ConversionResult run(Path workbook, Path reference, Path output)
            throws IOException, DicomException, DoseConversionException {
        IJ.showStatus("Reading Eyeplan dose: " + workbook.getFileName());
        IJ.showProgress(0, 5);
        EyeplanDoseTable table = EyeplanWorkbookReader.read(workbook);
        ScalarField3D field = GridParser.fromTable(table, options.getAxisMapping(), options.getDoseUnits());
        if (IJ.debugMode) IJ.log("Source field: " + field);

        IJ.showStatus("Reading reference dose: " + reference.getFileName());
        IJ.showProgress(1, 5);
        DicomDataset referenceMetadata = DicomFileReader.read(reference);
        VoxelGrid grid = ReferenceGeometryReader.read(referenceMetadata);
        if (IJ.debugMode) IJ.log("Reference grid: " + grid);

        IJ.showStatus("Resampling " + grid.voxelCount() + " voxels");
        IJ.showProgress(2, 5);
        ConversionResult result = converter.convert(field, grid, referenceMetadata);
        if (IJ.debugMode) IJ.log("Conversion: " + result);

        IJ.showStatus("Writing RT Dose: " + output.getFileName());
        IJ.showProgress(4, 5);
        DicomDataset dataset = converter.assemble(referenceMetadata, grid, result,
                table.getPatientName(), table.getPatientId());
        DicomFileWriter.write(dataset, output);

        IJ.showProgress(1.0);
        IJ.showStatus("Wrote " + output);
        return result;
    }
}
