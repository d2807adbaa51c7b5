/**
 * STS identity calls issued by SDKs and infrastructure tools at startup.
 */
package io.veraaws.services.sts;
