package com.adforge.core.provider;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One item of a dataset fetched from a provider.
 */
public record RemoteItem(String id, ObjectNode payload) {}
