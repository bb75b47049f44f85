/**
 * CoordHub source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.coordhub.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.coordhub.cli.CoordHubCommand} exposes the method surface over HTTP and stdio.</li>
 *   <li>{@code io.coordhub.dispatch.MethodDispatcher} resolves, validates and routes method calls.</li>
 *   <li>{@code io.coordhub.runtime.CoordHubRuntime} owns all coordination state behind one lock.</li>
 * </ul>
 */
package io.coordhub;
