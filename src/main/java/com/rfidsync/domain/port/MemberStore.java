package com.rfidsync.domain.port;

import com.rfidsync.domain.model.Member;
import com.rfidsync.domain.model.TrainingLink;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Puerto (interfaz) para la base local de miembros, capacitaciones y vínculos.
 * Las operaciones de escritura deben ejecutarse dentro de la transacción del llamador.
 */
public interface MemberStore {

    /**
     * Busca un miembro por su id de contacto.
     */
    Optional<Member> findByContactId(long contactId);

    /**
     * Inserta o actualiza la fila del miembro según su contact_id.
     */
    void upsertMember(Member member);

    /**
     * Cuenta los miembros que tienen asignado un tag.
     */
    long countMembersWithTag(long tagId);

    /**
     * Reemplaza los vínculos de un tag por los indicados, creando las capacitaciones nuevas.
     *
     * @param tagId  tag a actualizar
     * @param labels nombres de capacitaciones, sin duplicados
     * @return número de vínculos escritos
     */
    int replaceTrainingLinks(long tagId, Collection<String> labels);

    /**
     * Elimina todos los vínculos de un tag.
     *
     * @return número de vínculos eliminados
     */
    int deleteTrainingLinks(long tagId);

    List<Member> findAllMembers();

    List<TrainingLink> findAllLinks();

    List<String> findAllTrainings();

    /**
     * Elimina las capacitaciones que ya no tienen ningún vínculo.
     *
     * @return número de capacitaciones eliminadas
     */
    int deleteUnusedTrainings();
}
