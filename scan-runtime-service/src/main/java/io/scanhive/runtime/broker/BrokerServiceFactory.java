package io.scanhive.runtime.broker;

@FunctionalInterface
public interface BrokerServiceFactory {

    BrokerService create(String universe, String network);
}
