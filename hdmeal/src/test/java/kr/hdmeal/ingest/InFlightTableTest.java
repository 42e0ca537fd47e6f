package kr.hdmeal.ingest;

import kr.hdmeal.model.DataType;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InFlightTableTest {
    private static final LocalDate D1 = LocalDate.of(2024, 3, 1);
    private static final LocalDate D2 = D1.plusDays(1);
    private static final LocalDate D3 = D1.plusDays(2);

    @Test
    void secondClaimAttachesToOverlapAndOwnsTheRest() {
        InFlightTable table = new InFlightTable();

        InFlightTable.Claim first = table.claim(DataType.MEAL, List.of(D1, D2));
        InFlightTable.Claim second = table.claim(DataType.MEAL, List.of(D2, D3));

        assertEquals(List.of(D1, D2), List.copyOf(first.owned().dates));
        assertTrue(first.attached().isEmpty());
        assertEquals(List.of(first.owned()), second.attached());
        assertEquals(List.of(D3), List.copyOf(second.owned().dates));
        assertEquals(3, table.size());
    }

    @Test
    void typesAreTrackedSeparately() {
        InFlightTable table = new InFlightTable();
        table.claim(DataType.MEAL, List.of(D1));

        InFlightTable.Claim weather = table.claim(DataType.WEATHER, List.of(D1));

        assertNotNull(weather.owned());
        assertTrue(weather.attached().isEmpty());
    }

    @Test
    void fullyCoveredClaimOwnsNothing() {
        InFlightTable table = new InFlightTable();
        table.claim(DataType.MEAL, List.of(D1, D2, D3));

        InFlightTable.Claim c = table.claim(DataType.MEAL, List.of(D2));

        assertNull(c.owned());
        assertEquals(1, c.attached().size());
    }

    @Test
    void releaseFreesOnlyTheFlightsOwnCells() {
        InFlightTable table = new InFlightTable();
        InFlightTable.Flight a = table.claim(DataType.MEAL, List.of(D1)).owned();
        table.claim(DataType.MEAL, List.of(D2));

        table.release(a);
        a.outcome.complete(Map.of());

        assertEquals(1, table.size());
        assertNotNull(table.claim(DataType.MEAL, List.of(D1)).owned());
    }
}
