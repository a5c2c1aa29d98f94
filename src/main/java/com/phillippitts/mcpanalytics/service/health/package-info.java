/**
 * Actuator health contributions for the analytics engine.
 */
package com.phillippitts.mcpanalytics.service.health;
