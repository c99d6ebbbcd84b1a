package org.carball.lca.model.result;

/**
 * One traceable line inside a phase result: a material, a process step, a transport leg, ...
 */
public interface PhaseDetail {

    String label();

    double carbonKgCo2e();

    double energyMj();
}
