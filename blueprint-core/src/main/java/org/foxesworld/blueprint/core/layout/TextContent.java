package org.foxesworld.blueprint.core.layout;

/** What a text shadow node needs from its view in order to measure itself. */
public interface TextContent {

    String text();

    float fontSize();

    float lineHeight();
}
