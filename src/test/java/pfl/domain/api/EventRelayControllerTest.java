package pfl.domain.api;

import io.javalin.http.Context;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import pfl.dal.db.EventRelayRepository;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for EventRelayController
 * @since 22/01/2026
 */
@ExtendWith(MockitoExtension.class)
class EventRelayControllerTest {

    @Mock
    private EventRelayRepository relayRepository;
    @Mock
    private Context ctx;

    @Test
    @DisplayName("Should read from the start with the default page size")
    void shouldUseDefaults() {
        // Given
        when(relayRepository.readSince(0L, EventRelayController.DEFAULT_LIMIT)).thenReturn(List.of());

        // When
        new EventRelayController(relayRepository).getEvents(ctx);

        // Then
        verify(relayRepository).readSince(0L, 100);
    }

    @Test
    @DisplayName("Should clamp the page size to the maximum")
    void shouldClampLimit() {
        // Given
        when(ctx.queryParam("since")).thenReturn("42");
        when(ctx.queryParam("limit")).thenReturn("50000");
        when(relayRepository.readSince(42L, EventRelayController.MAX_LIMIT)).thenReturn(List.of());

        // When
        new EventRelayController(relayRepository).getEvents(ctx);

        // Then
        verify(relayRepository).readSince(42L, 1000);
    }

    @Test
    @DisplayName("Should answer 400 for a non-numeric cursor")
    void shouldRejectBadCursor() {
        // Given
        when(ctx.queryParam("since")).thenReturn("yesterday");
        when(ctx.status(anyInt())).thenReturn(ctx);

        // When
        new EventRelayController(relayRepository).getEvents(ctx);

        // Then
        verify(ctx).status(400);
        verify(relayRepository, never()).readSince(anyLong(), anyInt());
        verify(ctx).json(any());
    }
}
