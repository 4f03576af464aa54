package org.fuwapachi.repo;

import org.fuwapachi.model.Message;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

public interface MessageRepository extends JpaRepository<Message, Long> {

    // tirage aléatoire parmi les messages non supprimés
    @Query(value = "SELECT * FROM messages WHERE deleted_at IS NULL ORDER BY RAND() LIMIT :limit",
            nativeQuery = true)
    List<Message> findRandomActive(@Param("limit") int limit);

    // vérification d'existence + transition en une seule requête : 0 si absent ou déjà supprimé
    @Transactional
    @Modifying
    @Query("update Message m set m.deletedAt = :now where m.id = :id and m.deletedAt is null")
    int softDeleteIfActive(@Param("id") Long id, @Param("now") Instant now);
}
