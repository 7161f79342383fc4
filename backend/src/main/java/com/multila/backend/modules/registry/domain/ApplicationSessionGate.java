package com.multila.backend.modules.registry.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.multila.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;

/**
 * Public entry point that bundles several application sessions, e.g. variants of an app under test, and
 * forwards each visitor to the next active one in turn.
 */
@Entity
@Table(name = "application_session_gate")
public class ApplicationSessionGate extends AbstractTimestampedEntity {

    @Id
    @Column(name = "code", nullable = false, updatable = false, length = 10)
    private String code;

    @Column(name = "label", nullable = false, unique = true, length = 128)
    private String label;

    @Column(name = "description", nullable = false, length = 2048)
    private String description = "";

    @ManyToMany
    @JoinTable(
            name = "application_session_gate_member",
            joinColumns = @JoinColumn(name = "gate_code"),
            inverseJoinColumns = @JoinColumn(name = "application_session_code")
    )
    @OrderBy("code")
    private List<ApplicationSession> applicationSessions = new ArrayList<>();

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "next_forward_index", nullable = false)
    private int nextForwardIndex;

    protected ApplicationSessionGate() {
    }

    public ApplicationSessionGate(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<ApplicationSession> getApplicationSessions() {
        return applicationSessions;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public int getNextForwardIndex() {
        return nextForwardIndex;
    }

    /**
     * Picks the active application session at the forward index and advances the index. Callers hold a
     * row lock on the gate.
     */
    public Optional<ApplicationSession> forwardNext() {
        List<ApplicationSession> targets = applicationSessions.stream()
                .filter(ApplicationSession::isActive)
                .toList();
        if (!active || targets.isEmpty()) {
            return Optional.empty();
        }
        int index = nextForwardIndex % targets.size();
        nextForwardIndex = (index + 1) % targets.size();
        return Optional.of(targets.get(index));
    }
}
