package org.relaysync.handlers.domains;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Methods;
import io.undertow.util.StatusCodes;
import org.relaysync.service.RuleDomainService;
import org.relaysync.utils.HttpRequestUtil;
import org.relaysync.utils.ResponseUtil;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * GET, POST and DELETE of the domain list attached to one forward rule of one job.
 */
public class RuleDomainsHandler implements HttpHandler {

    private final RuleDomainService ruleDomains;

    public RuleDomainsHandler(RuleDomainService ruleDomains) {
        this.ruleDomains = ruleDomains;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String jobId = HttpRequestUtil.pathParam(exchange, "jobId");
        String ruleId = HttpRequestUtil.pathParam(exchange, "ruleId");

        if (Methods.GET.equals(exchange.getRequestMethod())) {
            ResponseUtil.sendSuccess(exchange, "Domains fetched", domains(ruleDomains.get(jobId, ruleId)));
        } else if (Methods.POST.equals(exchange.getRequestMethod())) {
            Map<String, Object> body = HttpRequestUtil.parseJson(exchange);
            if (body == null) return;

            Object value = body.get("domains");
            if (!(value instanceof List)) {
                ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, "domains must be a list");
                return;
            }
            List<String> saved = ruleDomains.set(jobId, ruleId, (List<?>) value);
            ResponseUtil.sendSuccess(exchange, "Domains saved", domains(saved));
        } else {
            ruleDomains.clear(jobId, ruleId);
            ResponseUtil.sendSuccess(exchange, "Domains deleted", null);
        }
    }

    private static Map<String, Object> domains(List<String> domains) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("domains", domains);
        return data;
    }
}
