package com.prepair.backend.repository;

import com.prepair.backend.entity.History;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface HistoryRepository extends JpaRepository<History, Long> {

    // Most recent first; page size bounds how many records are analysed
    @Query("SELECT h FROM History h WHERE h.user.id = :userId AND h.status = :status ORDER BY h.updatedAt DESC, h.id DESC")
    List<History> findRecentByUserAndStatus(@Param("userId") Long userId,
                                            @Param("status") History.HistoryStatus status,
                                            Pageable pageable);
}
