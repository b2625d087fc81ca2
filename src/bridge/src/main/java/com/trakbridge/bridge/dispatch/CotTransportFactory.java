package com.trakbridge.bridge.dispatch;

import com.trakbridge.bridge.config.BridgeProperties;

@FunctionalInterface
public interface CotTransportFactory {
  CotTransport open(BridgeProperties.Destination destination);
}
