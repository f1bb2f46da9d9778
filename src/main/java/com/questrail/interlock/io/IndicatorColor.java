package com.questrail.interlock.io;

/**
 * Colours of the client-facing indicator lamp.
 * White invites the client to take the product, red means keep out.
 */
public enum IndicatorColor
{
    RED,
    WHITE
}
