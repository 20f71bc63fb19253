package com.premiergroup.ad_delivery_engine.service;

import com.premiergroup.ad_delivery_engine.dto.BulkActionRequest;
import com.premiergroup.ad_delivery_engine.dto.BulkItemResult;
import com.premiergroup.ad_delivery_engine.dto.Caller;
import com.premiergroup.ad_delivery_engine.enums.BulkAction;
import com.premiergroup.ad_delivery_engine.enums.ErrorType;
import com.premiergroup.ad_delivery_engine.exception.ForbiddenOperationException;
import com.premiergroup.ad_delivery_engine.exception.InvalidStateException;
import com.premiergroup.ad_delivery_engine.exception.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
public class BulkActionServiceTest {

    private static final Caller STAFF = Caller.staff("staff-1");

    @Mock
    private AdvertisementService advertisementService;

    private BulkActionService bulkActionService;

    @BeforeEach
    public void setUp() {
        bulkActionService = new BulkActionService(advertisementService, new AccessPolicy());
    }

    @Test
    @MockitoSettings(strictness = Strictness.LENIENT)
    public void applyShouldReportEachItemIndependently() {
        // given
        UUID ok = UUID.randomUUID();
        UUID wrongState = UUID.randomUUID();
        UUID missing = UUID.randomUUID();
        given(advertisementService.pause(STAFF, wrongState))
                .willThrow(new InvalidStateException("Only active advertisements can be paused"));
        given(advertisementService.pause(STAFF, missing))
                .willThrow(NotFoundException.of("Advertisement", missing));

        // when
        List<BulkItemResult> results = bulkActionService.apply(STAFF,
                new BulkActionRequest(BulkAction.PAUSE, List.of(ok, wrongState, missing), null));

        // then
        assertThat(results).extracting(BulkItemResult::advertisementId).containsExactly(ok, wrongState, missing);
        assertThat(results).extracting(BulkItemResult::success).containsExactly(true, false, false);
        assertThat(results).extracting(BulkItemResult::error)
                .containsExactly(null, ErrorType.INVALID_STATE, ErrorType.NOT_FOUND);
    }

    @Test
    public void applyShouldProcessDuplicateIdsOnce() {
        // given
        UUID id = UUID.randomUUID();

        // when
        List<BulkItemResult> results = bulkActionService.apply(STAFF,
                new BulkActionRequest(BulkAction.APPROVE, List.of(id, id), "bulk approval"));

        // then
        assertThat(results).hasSize(1);
        verify(advertisementService, times(1)).approve(STAFF, id, "bulk approval");
    }

    @Test
    public void applyShouldRouteResume() {
        // given
        UUID id = UUID.randomUUID();

        // when
        bulkActionService.apply(STAFF, new BulkActionRequest(BulkAction.RESUME, List.of(id), null));

        // then
        verify(advertisementService).resume(STAFF, id);
    }

    @Test
    public void applyShouldRequireStaff() {
        // when and then
        assertThatThrownBy(() -> bulkActionService.apply(Caller.advertiser("adv-1"),
                new BulkActionRequest(BulkAction.PAUSE, List.of(UUID.randomUUID()), null)))
                .isInstanceOf(ForbiddenOperationException.class);
        verifyNoInteractions(advertisementService);
    }

    @Test
    public void applyShouldNotCatchUnexpectedErrors() {
        // given
        UUID id = UUID.randomUUID();
        given(advertisementService.pause(any(), any())).willThrow(new IllegalStateException("boom"));

        // when and then
        assertThatThrownBy(() -> bulkActionService.apply(STAFF,
                new BulkActionRequest(BulkAction.PAUSE, List.of(id), null)))
                .isInstanceOf(IllegalStateException.class);
    }
}
