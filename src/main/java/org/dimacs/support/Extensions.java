package org.dimacs.support;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Insiemi immutabili di {@link Extension} e mappatura dalle parole chiave
 * del problema .sat.
 *
 * MAPPATURA:
 * • sat   -> {}
 * • sate  -> {EQ}
 * • satx  -> {XOR}
 * • satex -> {EQ, XOR}
 */
public final class Extensions {

    /** Nessuna estensione (problema sat semplice) */
    public static final Set<Extension> NONE = Collections.unmodifiableSet(EnumSet.noneOf(Extension.class));

    /** Solo equivalenza */
    public static final Set<Extension> EQ = Collections.unmodifiableSet(EnumSet.of(Extension.EQ));

    /** Solo xor */
    public static final Set<Extension> XOR = Collections.unmodifiableSet(EnumSet.of(Extension.XOR));

    /** Equivalenza e xor */
    public static final Set<Extension> EQ_XOR = Collections.unmodifiableSet(EnumSet.allOf(Extension.class));

    private Extensions() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Copia immutabile di un insieme arbitrario di estensioni.
     *
     * @param extensions estensioni (non null, senza elementi null)
     * @return insieme immutabile equivalente
     */
    public static Set<Extension> of(Collection<Extension> extensions) {
        if (extensions == null || extensions.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Insieme estensioni non valido: " + extensions);
        }
        if (extensions.isEmpty()) {
            return NONE;
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(extensions));
    }

    /**
     * Parola chiave del problema .sat corrispondente a un insieme di estensioni.
     *
     * @param extensions insieme di estensioni
     * @return "sat", "sate", "satx" o "satex"
     */
    public static String problemKeyword(Set<Extension> extensions) {
        boolean eq = extensions.contains(Extension.EQ);
        boolean xor = extensions.contains(Extension.XOR);
        if (eq && xor) return "satex";
        if (eq) return "sate";
        if (xor) return "satx";
        return "sat";
    }
}
