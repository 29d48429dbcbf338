package org.kvplane.balance.strategy;

import org.kvplane.enums.RouterMode;
import org.kvplane.enums.StatusEnum;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class LoadBalanceStrategyFactory {

    private static final Map<RouterMode, LoadBalancer> loadBalancerFactory = new ConcurrentHashMap<>();

    public static void register(RouterMode mode, LoadBalancer loadBalancer) {
        loadBalancerFactory.put(mode, loadBalancer);
    }

    public static LoadBalancer getLoadBalancer(RouterMode mode) {
        LoadBalancer loadBalancer = loadBalancerFactory.get(mode);
        if (loadBalancer == null) {
            throw StatusEnum.CONFIG_ERROR.toException("no load balancer registered for router mode " + mode);
        }
        return loadBalancer;
    }
}
