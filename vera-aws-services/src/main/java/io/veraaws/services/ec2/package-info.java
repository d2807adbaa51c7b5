/**
 * EC2 control plane: resource catalog, query-protocol action handlers and the default VPC.
 *
 * <p>Attributes are stored under the member names the EC2 XML responses use, so describe calls
 * render a resource by adding its id, state and tag set to the stored tree.
 */
package io.veraaws.services.ec2;
