package kr.hdmeal.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import io.javalin.http.Context;
import kr.hdmeal.model.DateRange;
import kr.hdmeal.model.SyncResult;
import kr.hdmeal.service.ReadService;

import java.time.LocalDate;

/**
 * App endpoints: day views with every data type for a date or range,
 * synchronized on demand, and app metadata.
 */
final class ApiRoutesDays {
    private ApiRoutesDays() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        ReadService reads = api.reads();

        app.get("/api/app/days", ctx -> {
            DateRange range = rangeParam(ctx, reads);
            ReadService.Days days = reads.readDays(range);
            ctx.header(ApiServer.RANGE_HEADER, ApiServer.rangeHeader(range.start(), range.end()));

            ObjectNode out = om.createObjectNode();
            out.put("requestId", ApiServer.requestId(ctx));
            ObjectNode r = out.putObject("range");
            r.put("from", range.start().toString());
            r.put("to", range.end().toString());
            putSync(out, days.sync());
            out.set("data", om.valueToTree(days.days()));
            ctx.json(out);
        });

        app.get("/api/app/meta", ctx -> {
            ObjectNode out = om.createObjectNode();
            out.put("requestId", ApiServer.requestId(ctx));
            out.putObject("data")
                    .put("version", api.cfg().appVersion())
                    .put("build", api.cfg().appBuild())
                    .put("debug", api.cfg().debug());
            ctx.json(out);
        });

        app.get("/api/app/days/{day}", ctx -> {
            LocalDate day = LocalDate.parse(ctx.pathParam("day"));
            ReadService.Days days = reads.readDays(DateRange.single(day));
            ctx.header(ApiServer.RANGE_HEADER, ApiServer.rangeHeader(day, day));

            ObjectNode out = om.createObjectNode();
            out.put("requestId", ApiServer.requestId(ctx));
            putSync(out, days.sync());
            out.set("data", om.valueToTree(days.days().get(0)));
            ctx.json(out);
        });
    }

    private static void putSync(ObjectNode out, SyncResult sync) {
        out.put("sync", sync.status().name());
        var missing = out.putArray("missing");
        sync.missing().forEach(c -> missing.add(c.toString()));
    }

    /**
     * Reads {@code from}/{@code to}; both absent means the default window, a
     * lone {@code from} means that single day.
     */
    static DateRange rangeParam(Context ctx, ReadService reads) {
        String from = ctx.queryParam("from");
        String to = ctx.queryParam("to");
        if ((from == null || from.isBlank()) && (to == null || to.isBlank()))
            return reads.defaultRange();
        if (from == null || from.isBlank())
            throw new IllegalArgumentException("from is required when to is given");
        LocalDate start = LocalDate.parse(from.trim());
        LocalDate end = (to == null || to.isBlank()) ? start : LocalDate.parse(to.trim());
        return DateRange.of(start, end);
    }
}
