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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DoseEncoderTest {

    private static ResampledDoseVolume volume(double... values) {
        return ResampledDoseVolume.of(new int[] {values.length, 1, 1}, values, "GY");
    }

    @Test
    void encode_allZeroVolumeUsesUnitScaling() throws Exception {
        EncodedDoseVolume encoded = new DoseEncoder(EncodingOptions.defaults()).encode(volume(0, 0, 0, 0));

        assertThat(encoded.getScaleFactor()).isEqualTo(1.0);
        assertThat(encoded.maxRaw()).isZero();
        assertThat(encoded.getDoseUnits()).isEqualTo("GY");
    }

    @Test
    void encode_staysWithinHalfAStepOfEveryDose() throws Exception {
        double[] doses = {0, 1.5, 3.0, 2.2, 0.001, 2.9999};
        EncodingOptions options = new EncodingOptions(PixelWidth.UINT16, 0, EncodingOptions.DEFAULT_PRECISION_FLOOR);

        EncodedDoseVolume encoded = new DoseEncoder(options).encode(volume(doses));

        double scale = encoded.getScaleFactor();
        assertThat(scale).isGreaterThanOrEqualTo(3.0 / 65535);
        assertThat(scale).isLessThanOrEqualTo(3.0 / 65535 * (1 + 1e-9));
        assertThat(encoded.maxRaw()).isLessThanOrEqualTo(65535);
        for (int p = 0; p < doses.length; p++)
            assertThat(Math.abs(encoded.decode(p) - doses[p])).isLessThanOrEqualTo(scale / 2 * (1 + 1e-9));
    }

    @Test
    void encode_uses32BitPixelsByDefault() throws Exception {
        EncodedDoseVolume encoded = new DoseEncoder(EncodingOptions.defaults()).encode(volume(0, 70.0));

        assertThat(encoded.getPixelWidth()).isEqualTo(PixelWidth.UINT32);
        assertThat(encoded.getRaw(1)).isGreaterThan(65535L).isLessThanOrEqualTo(0xFFFFFFFFL);
        byte[] pixels = encoded.toPixelData();
        assertThat(pixels).hasSize(8);
        long raw = Integer.toUnsignedLong(ByteBuffer.wrap(pixels).order(ByteOrder.LITTLE_ENDIAN).getInt(4));
        assertThat(raw).isEqualTo(encoded.getRaw(1));
    }

    @Test
    void encode_writes16BitPixelsInTwoBytes() throws Exception {
        EncodingOptions options = new EncodingOptions(PixelWidth.UINT16, 0, EncodingOptions.DEFAULT_PRECISION_FLOOR);

        EncodedDoseVolume encoded = new DoseEncoder(options).encode(volume(1, 2, 4));

        assertThat(encoded.toPixelData()).hasSize(6);
        assertThat(encoded.getRaw(2)).isBetween(65534L, 65535L);
    }

    @Test
    void encode_zeroesDosesBelowTheThreshold() throws Exception {
        EncodingOptions options = new EncodingOptions(PixelWidth.UINT32, EncodingOptions.EYEPLAN_NOISE_FLOOR,
                EncodingOptions.DEFAULT_PRECISION_FLOOR);

        EncodedDoseVolume encoded = new DoseEncoder(options).encode(volume(5e-12, 1.0, 2e-12));

        assertThat(encoded.getRaw(0)).isZero();
        assertThat(encoded.getRaw(2)).isZero();
        assertThat(encoded.getRaw(1)).isPositive();
    }

    @Test
    void encode_neverScalesBelowThePrecisionFloor() throws Exception {
        EncodedDoseVolume encoded = new DoseEncoder(EncodingOptions.defaults()).encode(volume(1e-20, 0));

        assertThat(encoded.getScaleFactor()).isEqualTo(EncodingOptions.DEFAULT_PRECISION_FLOOR);
        assertThat(encoded.getRaw(0)).isZero();
    }

    @Test
    void scaleFactor_roundsUpToTenSignificantDigits() {
        double scale = DoseEncoder.scaleFactor(1.0, 3, 1e-12);

        assertThat(scale).isEqualTo(0.3333333334);
    }

    @Test
    void checkRange_rejectsValuesWiderThanThePixel() throws Exception {
        DoseEncoder.checkRange(new int[] {0, 65535}, PixelWidth.UINT16);
        DoseEncoder.checkRange(new int[] {-1}, PixelWidth.UINT32);

        assertThatThrownBy(() -> DoseEncoder.checkRange(new int[] {0, 65536}, PixelWidth.UINT16))
                .isInstanceOf(EncodingRangeException.class)
                .hasMessageContaining("voxel 1");
    }

    @Test
    void options_rejectInvalidValues() {
        assertThatThrownBy(() -> new EncodingOptions(PixelWidth.UINT16, -1, 1e-12))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PixelWidth.fromBits(8)).isInstanceOf(IllegalArgumentException.class);
    }
}
