package org.relaysync.client.account;

import org.relaysync.client.ClientException;
import org.relaysync.model.DeviceGroup;
import org.relaysync.model.ForwardRule;

import java.util.List;
import java.util.Map;

/**
 * Read access to a relay panel account.
 */
public interface AccountClient {

    AccountSession login(String host, String username, String password) throws ClientException;

    List<DeviceGroup> deviceGroups(AccountSession session) throws ClientException;

    UserInfo userInfo(AccountSession session) throws ClientException;

    TrafficStatistic trafficStatistic(AccountSession session) throws ClientException;

    /**
     * @param groups device groups by id, used to resolve each rule's inbound group name and connect host
     */
    List<ForwardRule> forwardRules(AccountSession session, Map<Long, DeviceGroup> groups) throws ClientException;

    void logout(AccountSession session) throws ClientException;
}
