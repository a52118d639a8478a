package com.prepair.backend.repository;

import com.prepair.backend.config.JpaAuditingConfig;
import com.prepair.backend.entity.History;
import com.prepair.backend.entity.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaAuditingConfig.class)
class HistoryRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private HistoryRepository historyRepository;

    private User user;

    @BeforeEach
    void setUp() {
        user = new User();
        user.setNickname("tester");
        entityManager.persist(user);

        User other = new User();
        other.setNickname("other");
        entityManager.persist(other);

        for (int i = 1; i <= 4; i++) {
            entityManager.persist(history(user, "q" + i, i * 10, History.HistoryStatus.ANSWERED));
        }
        entityManager.persist(history(user, "pending", null, History.HistoryStatus.PENDING));
        entityManager.persist(history(other, "someone else", 90, History.HistoryStatus.ANSWERED));
        entityManager.flush();
    }

    private static History history(User owner, String question, Integer score, History.HistoryStatus status) {
        History history = new History();
        history.setUser(owner);
        history.setQuestion(question);
        history.setAnswer(status == History.HistoryStatus.ANSWERED ? "answer to " + question : null);
        history.setScore(score);
        history.setStatus(status);
        return history;
    }

    @Test
    void shouldReturnAnsweredHistoryOfUserMostRecentFirst() {
        List<History> recent = historyRepository.findRecentByUserAndStatus(
                user.getId(), History.HistoryStatus.ANSWERED, PageRequest.of(0, 20));

        assertThat(recent).extracting(History::getQuestion).containsExactly("q4", "q3", "q2", "q1");
    }

    @Test
    void shouldLimitToPageSize() {
        List<History> recent = historyRepository.findRecentByUserAndStatus(
                user.getId(), History.HistoryStatus.ANSWERED, PageRequest.of(0, 2));

        assertThat(recent).extracting(History::getQuestion).containsExactly("q4", "q3");
    }

    @Test
    void shouldFillAuditColumns() {
        History stored = historyRepository.findRecentByUserAndStatus(
                user.getId(), History.HistoryStatus.ANSWERED, PageRequest.of(0, 1)).get(0);

        assertThat(stored.getCreatedAt()).isNotNull();
        assertThat(stored.getUpdatedAt()).isNotNull();
        assertThat(user.getPoints()).isZero();
    }
}
