package kr.hdmeal.api;

import io.javalin.Javalin;
import kr.hdmeal.model.CacheRecord;
import kr.hdmeal.model.DataType;
import kr.hdmeal.model.DateRange;
import kr.hdmeal.service.ReadService;

import java.util.List;

/**
 * Raw cached records of one type, without synchronizing.
 */
final class ApiRoutesCache {
    private ApiRoutesCache() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ReadService reads = api.reads();

        app.get("/api/cache/{type}", ctx -> {
            DataType type = DataType.parse(ctx.pathParam("type"));
            DateRange range = ApiRoutesDays.rangeParam(ctx, reads);
            String grade = ctx.queryParam("grade");
            String classNo = ctx.queryParam("class");

            List<CacheRecord> records;
            if (grade != null && classNo != null) {
                records = reads.readCached(type, range, parseInt(grade, "grade"), parseInt(classNo, "class"));
            } else {
                records = reads.readCached(type, range);
            }
            ctx.header(ApiServer.RANGE_HEADER, ApiServer.rangeHeader(range.start(), range.end()));
            ctx.json(records);
        });
    }

    private static int parseInt(String s, String name) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number");
        }
    }
}
