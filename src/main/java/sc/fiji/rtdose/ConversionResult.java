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
 * What {@link DoseConverter#convert} produces: the doses on the reference grid, their integer encoding,
 * and the identity of the object they will be written as.
 */
public class ConversionResult {
    private final ResampledDoseVolume resampled;
    private final EncodedDoseVolume encoded;
    private final OutputIdentity identity;
    private final VoxelGrid grid;

    public ConversionResult(ResampledDoseVolume resampled, EncodedDoseVolume encoded, OutputIdentity identity,
                            VoxelGrid grid) {
        this.grid = grid;
        this.resampled = resampled;
        this.encoded = encoded;
        this.identity = identity;
    }

    public ResampledDoseVolume getResampled() {
        return resampled;
    }

    public EncodedDoseVolume getEncoded() {
        return encoded;
    }

    public OutputIdentity getIdentity() {
        return identity;
    }

    /** The reference grid the doses were resampled onto. */
    public VoxelGrid getGrid() {
        return grid;
    }

    public String toString() {
        return "ConversionResult(" + encoded + ", " + identity + ")";
    }
}
