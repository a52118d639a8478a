package com.prepair.backend.entity;

import lombok.*;
import jakarta.persistence.*;

@Entity
@Table(name = "users", indexes = {
        @Index(name = "idx_nickname", columnList = "nickname")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class User extends BaseEntity {

    @Column(nullable = false, length = 50)
    private String nickname;

    // Sum of all awarded answer scores
    @Column(nullable = false)
    private Long points = 0L;

    public void addPoints(int awarded) {
        this.points = (points == null ? 0L : points) + awarded;
    }
}
