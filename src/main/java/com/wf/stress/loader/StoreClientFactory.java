package com.wf.stress.loader;

import com.wf.stress.config.Endpoint;
import com.wf.stress.store.StoreClient;

@FunctionalInterface
public interface StoreClientFactory {

    StoreClient connect(Endpoint endpoint);
}
