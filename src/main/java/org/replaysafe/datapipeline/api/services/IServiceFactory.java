package org.replaysafe.datapipeline.api.services;

@FunctionalInterface
public interface IServiceFactory {

    IService create();
}
