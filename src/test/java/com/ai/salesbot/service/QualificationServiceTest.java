package com.ai.salesbot.service;

import com.ai.salesbot.auth.SalesBotApplication;
import com.ai.salesbot.dto.DashboardEvent;
import com.ai.salesbot.dto.DateRange;
import com.ai.salesbot.dto.QualificationStats;
import com.ai.salesbot.dto.QualificationUpdate;
import com.ai.salesbot.entity.CallSession;
import com.ai.salesbot.entity.LeadQualification;
import com.ai.salesbot.exception.NotFoundException;
import com.ai.salesbot.exception.ValidationException;
import com.ai.salesbot.repository.CallSessionRepository;
import com.ai.salesbot.utils.QualificationLevel;
import com.ai.salesbot.websocket.EventBroadcaster;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ContextConfiguration;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@DataJpaTest
@ContextConfiguration(classes = SalesBotApplication.class)
@Import(QualificationService.class)
@DisplayName("QualificationService")
class QualificationServiceTest {

    @Autowired
    private QualificationService service;

    @Autowired
    private CallSessionRepository callRepository;

    @MockBean
    private EventBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        callRepository.save(CallSession.builder().callId("CA-Q1").startTime(Instant.now()).build());
        callRepository.save(CallSession.builder().callId("CA-Q2").startTime(Instant.now()).build());
    }

    @Test
    @DisplayName("the total is the sum of the four dimensions")
    void totalIsSum() {
        LeadQualification q = service.updateScore("CA-Q1", QualificationUpdate.builder()
                .budget(8).authority(6).need(9).timeline(7).build());

        assertThat(q.getQualificationScore()).isEqualTo(30);
        assertThat(q.getQualificationLevel()).isEqualTo(QualificationLevel.HIGH);
        verify(broadcaster).publish(eq(DashboardEvent.QUALIFICATION_UPDATED), eq("CA-Q1"), any());
    }

    @Test
    @DisplayName("partial updates keep the other dimensions")
    void partialMerge() {
        service.updateScore("CA-Q1", QualificationUpdate.builder().budget(5).need(5).build());

        LeadQualification q = service.updateScore("CA-Q1", QualificationUpdate.builder()
                .authority(9).authorityNotes("owner").build());

        assertThat(q.getBudget().getScore()).isEqualTo(5);
        assertThat(q.getAuthority().getNotes()).isEqualTo("owner");
        assertThat(q.getQualificationScore()).isEqualTo(19);
        assertThat(q.getQualificationLevel()).isEqualTo(QualificationLevel.LOW);
        assertThat(service.currentScore("CA-Q1")).isEqualTo(19);
    }

    @Test
    @DisplayName("an out-of-range score rejects the whole update")
    void outOfRange() {
        service.updateScore("CA-Q1", QualificationUpdate.builder().budget(4).build());

        assertThatThrownBy(() -> service.updateScore("CA-Q1", QualificationUpdate.builder()
                .budget(9).need(11).build()))
                .isInstanceOf(ValidationException.class);

        assertThat(service.get("CA-Q1").getBudget().getScore()).isEqualTo(4);
    }

    @Test
    @DisplayName("unknown calls cannot be qualified and score zero")
    void unknownCall() {
        assertThatThrownBy(() -> service.updateScore("missing", QualificationUpdate.builder().budget(1).build()))
                .isInstanceOf(NotFoundException.class);
        assertThat(service.currentScore("missing")).isZero();
    }

    @Test
    @DisplayName("stats count leads per level")
    void stats() {
        service.updateScore("CA-Q1", QualificationUpdate.builder().budget(10).authority(10).need(10).build());
        service.updateScore("CA-Q2", QualificationUpdate.builder().budget(5).build());

        QualificationStats stats = service.stats(DateRange.all());

        assertThat(stats.getTotalLeads()).isEqualTo(2);
        assertThat(stats.getAverageScore()).isEqualTo(17.5);
        assertThat(stats.getQualifiedLeads()).isEqualTo(1);
        assertThat(stats.getHighLevel()).isEqualTo(1);
        assertThat(stats.getUnqualified()).isEqualTo(1);
    }
}
