package com.pluginexec.core.sandbox.network;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * 主机名解析
 */
@FunctionalInterface
public interface HostResolver {

    HostResolver SYSTEM = InetAddress::getAllByName;

    InetAddress[] resolve(String host) throws UnknownHostException;
}
