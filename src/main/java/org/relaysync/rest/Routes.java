package org.relaysync.rest;

import io.undertow.Handlers;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import org.relaysync.handlers.HealthCheckHandler;
import org.relaysync.handlers.auth.LoginHandler;
import org.relaysync.handlers.auth.LogoutHandler;
import org.relaysync.handlers.config.GetConfigHandler;
import org.relaysync.handlers.config.UpdateConfigHandler;
import org.relaysync.handlers.domains.RuleDomainsHandler;
import org.relaysync.handlers.jobs.CreateJobHandler;
import org.relaysync.handlers.jobs.DeleteJobHandler;
import org.relaysync.handlers.jobs.GetJobHandler;
import org.relaysync.handlers.jobs.TriggerRunHandler;
import org.relaysync.handlers.jobs.UpdateJobHandler;
import org.relaysync.rest.base.Dispatcher;
import org.relaysync.rest.base.FallBack;
import org.relaysync.rest.base.InvalidMethod;

import static org.relaysync.rest.base.RouteUtils.publicRoute;
import static org.relaysync.rest.base.RouteUtils.userSessionRequired;

public class Routes {

    private Routes() {}

    public static RoutingHandler auth(AppContext ctx) {
        return finish(Handlers.routing()
                .post("/login", publicRoute(new LoginHandler(ctx.auth())))
                .post("/logout", userSessionRequired(new LogoutHandler(), ctx.auth())));
    }

    public static RoutingHandler system(AppContext ctx) {
        return finish(Handlers.routing()
                .get("/health", publicRoute(new HealthCheckHandler(ctx.scheduler()))));
    }

    public static RoutingHandler config(AppContext ctx) {
        HttpHandler get = userSessionRequired(new GetConfigHandler(ctx.jobs()), ctx.auth());
        HttpHandler update = userSessionRequired(new UpdateConfigHandler(ctx.jobs()), ctx.auth());

        return finish(Handlers.routing()
                .get("", get)
                .get("/", get)
                .post("", update)
                .post("/", update));
    }

    public static RoutingHandler jobs(AppContext ctx) {
        HttpHandler create = userSessionRequired(new CreateJobHandler(ctx.jobs()), ctx.auth());

        return finish(Handlers.routing()
                .post("", create)
                .post("/", create)
                .get("/{jobId}", userSessionRequired(new GetJobHandler(ctx.jobs()), ctx.auth()))
                .put("/{jobId}", userSessionRequired(new UpdateJobHandler(ctx.jobs()), ctx.auth()))
                .delete("/{jobId}", userSessionRequired(new DeleteJobHandler(ctx.jobs()), ctx.auth())));
    }

    public static RoutingHandler run(AppContext ctx) {
        return finish(Handlers.routing()
                .post("/{jobId}", userSessionRequired(new TriggerRunHandler(ctx.jobs()), ctx.auth())));
    }

    public static RoutingHandler domains(AppContext ctx) {
        HttpHandler domains = userSessionRequired(new RuleDomainsHandler(ctx.ruleDomains()), ctx.auth());

        return finish(Handlers.routing()
                .get("/{jobId}/{ruleId}", domains)
                .post("/{jobId}/{ruleId}", domains)
                .delete("/{jobId}/{ruleId}", domains));
    }

    private static RoutingHandler finish(RoutingHandler routes) {
        return routes
                .setInvalidMethodHandler(new Dispatcher(new InvalidMethod()))
                .setFallbackHandler(new Dispatcher(new FallBack()));
    }
}
