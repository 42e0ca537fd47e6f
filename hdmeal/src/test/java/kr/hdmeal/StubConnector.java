package kr.hdmeal;

import kr.hdmeal.model.DataType;
import kr.hdmeal.model.DateRange;
import kr.hdmeal.upstream.Connector;
import kr.hdmeal.upstream.RawRecord;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Connector answering from a fixed list of raw records, for every data type
 * unless told otherwise.
 */
public final class StubConnector implements Connector {
    private final List<RawRecord> records = new CopyOnWriteArrayList<>();
    private final Set<DataType> types;

    public StubConnector() {
        this(EnumSet.allOf(DataType.class));
    }

    public StubConnector(Set<DataType> types) {
        this.types = EnumSet.copyOf(types);
    }

    public StubConnector add(RawRecord r) {
        records.add(r);
        return this;
    }

    @Override
    public String name() {
        return "STUB";
    }

    @Override
    public Set<DataType> dataTypes() {
        return types;
    }

    @Override
    public int maxSpanDays() {
        return 31;
    }

    @Override
    public List<RawRecord> fetch(DataType type, DateRange range) {
        List<RawRecord> out = new ArrayList<>();
        for (RawRecord r : records) {
            if (r.type() == type && range.contains(r.date()))
                out.add(r);
        }
        return out;
    }
}
