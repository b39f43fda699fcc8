/**
 * Mode dispatch from configuration.
 */
package com.dcv.main;
