/**
 * Public surface of the vSphere client.
 *
 * <p>This package contains:
 * <ul>
 *   <li>{@link org.tanzu.vcenterperf.vcenter.VimApiClient} – result-object facade over session, inventory and metric operations.</li>
 *   <li>{@link org.tanzu.vcenterperf.vcenter.VCenterService} – MCP tool implementations built on the facade.</li>
 * </ul>
 *
 * <p>Facade operations never throw for API failures; they return an {@link org.tanzu.vcenterperf.vcenter.ApiResult}
 * whose {@code error} is empty on success.
 */
package org.tanzu.vcenterperf.vcenter;
