package com.rfidsync.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Miembro sincronizado desde el directorio.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Member {

    /** Clave estable del directorio */
    private long contactId;

    private long tagId;

    private int membershipLevel;
}
