package org.relaysync.rest;

import org.relaysync.config.XmlConfiguration;
import org.relaysync.engine.JobScheduler;
import org.relaysync.service.AuthService;
import org.relaysync.service.JobAdminService;
import org.relaysync.service.RuleDomainService;

/**
 * What the route table needs: process configuration and the admin services.
 */
public record AppContext(
        XmlConfiguration cfg,
        JobAdminService jobs,
        RuleDomainService ruleDomains,
        AuthService auth,
        JobScheduler scheduler) {
}
