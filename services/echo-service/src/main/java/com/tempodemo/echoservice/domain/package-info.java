/** Header rendering and the simulated latency of the echo endpoint. */
package com.tempodemo.echoservice.domain;
