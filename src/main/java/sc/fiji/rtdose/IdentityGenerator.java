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

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Generates the Study, Series and SOP Instance UIDs of a converted dose object.
 * By default UIDs are derived from random UUIDs under the "2.25" root.
 */
public class IdentityGenerator {
    /** Produces one new UID per call. */
    public interface UidSource {
        String createUid();
    }

    public static final String UUID_ROOT = "2.25.";
    public static final int MAX_UID_LENGTH = 64;
    // A collision with a random UUID means the source is broken, so a few attempts are plenty.
    static final int MAX_ATTEMPTS = 8;
    private static final Pattern UID_PAT = Pattern.compile("(0|[1-9]\\d*)(\\.(0|[1-9]\\d*))*");

    public static final UidSource UUID_DERIVED = () -> {
        UUID uuid = UUID.randomUUID();
        ByteBuffer buf = ByteBuffer.allocate(16);
        buf.putLong(uuid.getMostSignificantBits());
        buf.putLong(uuid.getLeastSignificantBits());
        return UUID_ROOT + new BigInteger(1, buf.array());
    };

    private final UidSource source;

    public IdentityGenerator() {
        this(UUID_DERIVED);
    }

    public IdentityGenerator(UidSource source) {
        this.source = source;
    }

    /**
     * @param reserved  UIDs the new ones must differ from, typically those of the reference object. Nulls are ignored.
     * @throws IdentityGenerationException  When the UID source fails, returns invalid UIDs, or keeps repeating itself.
     */
    public OutputIdentity generate(Collection<String> reserved) throws IdentityGenerationException {
        Set<String> taken = new HashSet<>();
        for (String uid : reserved)
            if (uid != null) taken.add(uid);
        String study = next(taken);
        String series = next(taken);
        String instance = next(taken);
        return new OutputIdentity(study, series, instance);
    }

    private String next(Set<String> taken) throws IdentityGenerationException {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String uid;
            try {
                uid = source.createUid();
            } catch (RuntimeException e) {
                throw new IdentityGenerationException("The UID source failed: " + e.getMessage(), e);
            }
            if (!isValid(uid))
                throw new IdentityGenerationException("The UID source produced an invalid UID: '" + uid + "'");
            if (taken.add(uid)) return uid;
        }
        throw new IdentityGenerationException("The UID source produced no unused UID in " + MAX_ATTEMPTS + " attempts.");
    }

    public static boolean isValid(String uid) {
        return uid != null && !uid.isEmpty() && uid.length() <= MAX_UID_LENGTH && UID_PAT.matcher(uid).matches();
    }
}
