/**
 * Configuration for the vSphere performance client.
 *
 * <p>Provides SDK connection settings ({@link org.tanzu.vcenterperf.config.VCenterConfig}),
 * Cloud Foundry VCAP_SERVICES processing ({@link org.tanzu.vcenterperf.config.VCenterConfigProcessor}),
 * and the WebClient/pacing setup with optional insecure SSL ({@link org.tanzu.vcenterperf.config.WebClientConfig}).
 */
package org.tanzu.vcenterperf.config;
